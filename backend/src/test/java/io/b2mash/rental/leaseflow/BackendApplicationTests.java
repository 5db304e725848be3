package io.b2mash.rental.leaseflow;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.invitation.InvitationExpiryProcessor;
import io.b2mash.rental.leaseflow.proofing.VerificationGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class BackendApplicationTests {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads_withSchemaValidatedByHibernate() {
    assertThat(context.getBean(ContractStateMachine.class)).isNotNull();
    assertThat(context.getBean(VerificationGateway.class)).isNotNull();
  }

  @Test
  void expirySweep_isDisabledInTestProfile() {
    assertThat(context.getBeanNamesForType(InvitationExpiryProcessor.class)).isEmpty();
  }
}
