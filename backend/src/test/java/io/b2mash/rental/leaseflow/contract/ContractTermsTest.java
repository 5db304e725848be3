package io.b2mash.rental.leaseflow.contract;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ContractTermsTest {

  @Test
  void empty_reportsEveryFieldMissing() {
    assertThat(ContractTerms.empty().missingFields())
        .containsExactly("monthlyRent", "securityDeposit", "durationMonths", "startDate");
    assertThat(ContractTerms.empty().isComplete()).isFalse();
  }

  @Test
  void missingFields_rejectsNonPositiveRentAndDuration() {
    var terms = new ContractTerms(BigDecimal.ZERO, BigDecimal.ZERO, 0, LocalDate.of(2026, 1, 1));

    assertThat(terms.missingFields()).containsExactly("monthlyRent", "durationMonths");
  }

  @Test
  void missingFields_acceptsZeroDeposit() {
    var terms =
        new ContractTerms(new BigDecimal("900.00"), BigDecimal.ZERO, 6, LocalDate.of(2026, 1, 1));

    assertThat(terms.isComplete()).isTrue();
  }

  @Test
  void missingFields_rejectsNegativeDeposit() {
    var terms =
        new ContractTerms(
            new BigDecimal("900.00"), new BigDecimal("-1"), 6, LocalDate.of(2026, 1, 1));

    assertThat(terms.missingFields()).containsExactly("securityDeposit");
  }

  @Test
  void equals_comparesAllFields() {
    var start = LocalDate.of(2026, 1, 1);
    var a = new ContractTerms(new BigDecimal("900.00"), BigDecimal.TEN, 6, start);
    var b = new ContractTerms(new BigDecimal("900.00"), BigDecimal.TEN, 6, start);
    var c = new ContractTerms(new BigDecimal("950.00"), BigDecimal.TEN, 6, start);

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a).isNotEqualTo(c);
  }
}
