package io.b2mash.rental.leaseflow.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Economic terms of a contract. Immutable: a revision replaces the whole value. Fields may be null
 * while the landlord is still drafting; {@link #missingFields()} lists what blocks review.
 */
@Embeddable
public class ContractTerms {

  @Column(name = "monthly_rent", precision = 14, scale = 2)
  private BigDecimal monthlyRent;

  @Column(name = "security_deposit", precision = 14, scale = 2)
  private BigDecimal securityDeposit;

  @Column(name = "duration_months")
  private Integer durationMonths;

  @Column(name = "start_date")
  private LocalDate startDate;

  /** JPA-required no-arg constructor. */
  protected ContractTerms() {}

  public ContractTerms(
      BigDecimal monthlyRent,
      BigDecimal securityDeposit,
      Integer durationMonths,
      LocalDate startDate) {
    this.monthlyRent = monthlyRent;
    this.securityDeposit = securityDeposit;
    this.durationMonths = durationMonths;
    this.startDate = startDate;
  }

  public static ContractTerms empty() {
    return new ContractTerms(null, null, null, null);
  }

  /** Names of the fields that are absent or out of range. Empty when the terms are complete. */
  public List<String> missingFields() {
    var missing = new ArrayList<String>();
    if (monthlyRent == null || monthlyRent.signum() <= 0) {
      missing.add("monthlyRent");
    }
    if (securityDeposit == null || securityDeposit.signum() < 0) {
      missing.add("securityDeposit");
    }
    if (durationMonths == null || durationMonths <= 0) {
      missing.add("durationMonths");
    }
    if (startDate == null) {
      missing.add("startDate");
    }
    return missing;
  }

  public boolean isComplete() {
    return missingFields().isEmpty();
  }

  public BigDecimal getMonthlyRent() {
    return monthlyRent;
  }

  public BigDecimal getSecurityDeposit() {
    return securityDeposit;
  }

  public Integer getDurationMonths() {
    return durationMonths;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ContractTerms other)) {
      return false;
    }
    return Objects.equals(monthlyRent, other.monthlyRent)
        && Objects.equals(securityDeposit, other.securityDeposit)
        && Objects.equals(durationMonths, other.durationMonths)
        && Objects.equals(startDate, other.startDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(monthlyRent, securityDeposit, durationMonths, startDate);
  }

  @Override
  public String toString() {
    return "ContractTerms[monthlyRent="
        + monthlyRent
        + ", securityDeposit="
        + securityDeposit
        + ", durationMonths="
        + durationMonths
        + ", startDate="
        + startDate
        + "]";
  }
}
