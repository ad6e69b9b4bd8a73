package io.orion.pms.backend.domain;

/**
 * Maps a WBS/EPC code to an EPCIC phase using the first character of the code, upper-cased:
 * E=Engineering, P=Procurement, C=Construction, I=Installation, M=Commissioning.
 *
 * <p>Any other leading character, leading whitespace included, and a missing or blank code fall
 * back to CONSTRUCTION. The single-character rule is kept exactly as the dashboards have always
 * applied it so that domain totals stay comparable with earlier reports.
 */
public final class DomainClassifier {

  public static final DomainType FALLBACK = DomainType.CONSTRUCTION;

  private DomainClassifier() {}

  public static DomainType classifyDomain(String wbsCode) {
    if (wbsCode == null || wbsCode.isBlank()) {
      return FALLBACK;
    }
    return switch (Character.toUpperCase(wbsCode.charAt(0))) {
      case 'E' -> DomainType.ENGINEERING;
      case 'P' -> DomainType.PROCUREMENT;
      case 'C' -> DomainType.CONSTRUCTION;
      case 'I' -> DomainType.INSTALLATION;
      case 'M' -> DomainType.COMMISSIONING;
      default -> FALLBACK;
    };
  }
}
