package io.tower.api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class RunArgumentsTest {
   @Test
   public void testRequiredFields() {
      assertThrows(TowerDefinitionException.class, () -> RunArguments.builder().project("p").tag("t").build());
      assertThrows(TowerDefinitionException.class, () -> RunArguments.builder().tag("t").serverIpAddress("h").build());
      assertThrows(TowerDefinitionException.class, () -> RunArguments.builder().project("p").tag("").serverIpAddress("h").build());
   }

   @Test
   public void testTagsAreNormalized() {
      RunArguments arguments = RunArguments.builder().project("p").tag(" Smoke,API ,, ").untag("Slow")
            .serverIpAddress("10.1.1.1").feature("").build();
      assertThat(arguments.tags()).containsExactly("smoke", "api");
      assertThat(arguments.untags()).containsExactly("slow");
      assertThat(arguments.feature()).isNull();
      assertThat(arguments.untag()).isEqualTo("Slow");
   }

   @Test
   public void testCaseLoops() {
      RunArguments arguments = RunArguments.builder().project("p").tag("t").serverIpAddress("h")
            .caseLoops(Map.of("login", Map.of("L-1", 4)))
            .caseLoop("login", "L-2", 2)
            .build();
      assertThat(arguments.caseLoops().get("login")).containsEntry("L-1", 4).containsEntry("L-2", 2);
      assertThrows(TowerDefinitionException.class, () -> RunArguments.builder().caseLoop("login", "L-1", 0));
      assertThrows(UnsupportedOperationException.class, () -> arguments.caseLoops().put("cart", Map.of()));
   }
}
