package io.tower.api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.tower.api.CaseContext;

public class ProjectBuilderTest {
   @Test
   public void testBuildTree() {
      ProjectDefinition project = ProjectBuilder.builder("shop")
            .runBy(RunBy.SKIP)
            .detailLogMode(DetailLogMode.BOTH)
            .setup(ctx -> 0).endCase()
            .addFeature("login")
               .teardown(ctx -> 0).skip(true).endCase()
               .addCase("L-1").title("valid password").labels("Smoke", " ").loop(2).order(0.5).body(ctx -> 0)
                  .step("open", input -> "page").locked(false).timeoutMillis(-1).frequencyMillis(100).endStep()
                  .step("submit", input -> true).failContinue(true).endStep()
               .endCase()
               .addFeature("sso")
                  .addCase("S-1").title("google").body(ctx -> 0).endCase()
               .endFeature()
            .endFeature()
            .build();

      assertThat(project.name).isEqualTo("shop");
      assertThat(project.detailLogMode).isEqualTo(DetailLogMode.BOTH);
      assertThat(project.setup.flag).isEqualTo(CaseFlag.SETUP);
      assertThat(project.setup.level).isEqualTo(CaseLevel.PROJECT);
      assertThat(project.setup.caseTitle).isEqualTo("project setup");

      FeatureDefinition login = project.features.get(0);
      assertThat(login.teardown.skip).isFalse();
      assertThat(login.teardown.caseTitle).isEqualTo("login teardown");
      CaseDefinition l1 = login.cases.get(0);
      assertThat(l1.fullName()).isEqualTo("TestCase: L-1, valid password");
      assertThat(l1.labels).containsExactly("smoke");
      assertThat(l1.skip).isTrue();
      assertThat(l1.locked).isTrue();
      assertThat(l1.loop).isEqualTo(2);
      assertThat(l1.order).isEqualTo(0.5);
      assertThat(l1.steps).extracting(s -> s.name).containsExactly("open", "submit");
      assertThat(l1.steps.get(0).index).isEqualTo(1);
      assertThat(l1.steps.get(0).locked).isFalse();
      assertThat(l1.steps.get(0).timeout).isEqualTo(-1);
      assertThat(l1.steps.get(1).failContinue).isTrue();

      CaseDefinition s1 = login.children.get(0).cases.get(0);
      assertThat(s1.labels).containsExactlyInAnyOrder("sso", "s-1");
   }

   @Test
   public void testDuplicateCaseNumber() {
      FeatureBuilder<ProjectBuilder> login = ProjectBuilder.builder("shop").addFeature("login");
      login.addCase("TC-1").title("first").body(ctx -> 0);
      DuplicateCaseNumberException e = assertThrows(DuplicateCaseNumberException.class,
            () -> login.endFeature().addFeature("cart").addCase("TC-1"));
      assertThat(e.caseNum()).isEqualTo("TC-1");
      assertThat(e.getMessage()).contains("login");
   }

   @Test
   public void testSetupDoesNotReserveNumbers() {
      ProjectDefinition project = ProjectBuilder.builder("shop")
            .addFeature("a").setup(ctx -> 0).endCase().endFeature()
            .addFeature("b").setup(ctx -> 0).endCase().addCase("setup").title("named setup").body(ctx -> 0).endCase().endFeature()
            .build();
      assertThat(project.features).hasSize(2);
   }

   @Test
   public void testDuplicateFeatureAndFixture() {
      ProjectBuilder builder = ProjectBuilder.builder("shop");
      builder.addFeature("login");
      assertThrows(TowerDefinitionException.class, () -> builder.addFeature("login"));
      FeatureBuilder<ProjectBuilder> cart = builder.addFeature("cart");
      cart.setup(ctx -> 0);
      assertThrows(TowerDefinitionException.class, () -> cart.setup(ctx -> 0));
      builder.setup(ctx -> 0);
      assertThrows(TowerDefinitionException.class, () -> builder.setup(ctx -> 0));
   }

   @Test
   public void testInvalidCases() {
      assertInvalid(f -> f.addCase("TC-1").body(ctx -> 0));
      assertInvalid(f -> f.addCase("TC-1").title("no body"));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0).loop(0));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0).timeoutMillis(-2));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0).frequencyMillis(0));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0)
            .addStep("same", input -> 1).addStep("same", input -> 2));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0).addStep("", input -> 1));
      assertInvalid(f -> f.addCase("TC-1").title("t").body(ctx -> 0).step("s", input -> 1).frequencyMillis(-5));
      assertThrows(TowerDefinitionException.class, () -> ProjectBuilder.builder("p").addFeature("f").addCase(""));
      assertThrows(TowerDefinitionException.class, () -> ProjectBuilder.builder(""));
   }

   @Test
   public void testTimeUnits() {
      ProjectDefinition project = ProjectBuilder.builder("units")
            .addFeature("f")
               .addCase("TC-1").title("seconds").timeout("10").frequency("2").body(ctx -> 0)
                  .step("forever", input -> 1).timeout("-1").frequency("250ms").endStep()
                  .step("once", input -> 2).timeout("0").endStep()
               .endCase()
               .addCase("TC-2").title("minutes").timeout("2m").frequencyMillis(50).body(ctx -> 0).endCase()
            .endFeature()
            .build();
      CaseDefinition tc1 = project.features.get(0).cases.get(0);
      assertThat(tc1.timeout).isEqualTo(10_000);
      assertThat(tc1.frequency).isEqualTo(2_000);
      assertThat(tc1.steps.get(0).timeout).isEqualTo(-1);
      assertThat(tc1.steps.get(0).frequency).isEqualTo(250);
      assertThat(tc1.steps.get(1).timeout).isZero();
      CaseDefinition tc2 = project.features.get(0).cases.get(1);
      assertThat(tc2.timeout).isEqualTo(120_000);
      assertThat(tc2.frequency).isEqualTo(50);

      assertThrows(TowerDefinitionException.class, () -> ProjectBuilder.builder("p").addFeature("f")
            .addCase("TC-1").timeout("soon"));
   }

   @Test
   public void testBaseCase() {
      ProjectDefinition project = ProjectBuilder.builder("shop")
            .addFeature("login")
               .addCase(new LoginCase())
            .endFeature()
            .build();
      CaseDefinition c = project.features.get(0).cases.get(0);
      assertThat(c.caseNum).isEqualTo("L-7");
      assertThat(c.caseTitle).isEqualTo("login with token");
      assertThat(c.labels).containsExactly("auth");
      assertThat(c.locked).isFalse();
      assertThat(c.steps).hasSize(1);
      assertThat(c.body).isInstanceOf(LoginCase.class);

      assertThrows(TowerDefinitionException.class, () -> ProjectBuilder.builder("shop").addFeature("login")
            .addCase(new LoginCase() {
               @Override
               public String caseTitle() {
                  return null;
               }
            }));
   }

   private static void assertInvalid(java.util.function.Consumer<FeatureBuilder<ProjectBuilder>> configure) {
      ProjectBuilder builder = ProjectBuilder.builder("invalid");
      configure.accept(builder.addFeature("f"));
      assertThrows(TowerDefinitionException.class, builder::build);
   }

   private static class LoginCase extends BaseCase {
      @Override
      public String caseNum() {
         return "L-7";
      }

      @Override
      public String caseTitle() {
         return "login with token";
      }

      @Override
      public List<String> labels() {
         return List.of("Auth");
      }

      @Override
      protected void configure(CaseBuilder<?> builder) {
         builder.locked(false).addStep("token", input -> "secret");
      }

      @Override
      public int run(CaseContext ctx) {
         return 0;
      }
   }
}
