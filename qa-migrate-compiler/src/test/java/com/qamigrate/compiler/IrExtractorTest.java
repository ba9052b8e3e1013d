package com.qamigrate.compiler;

import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstTree;
import com.qamigrate.compiler.extraction.ExtractedStep;
import com.qamigrate.compiler.extraction.ExtractedSuite;
import com.qamigrate.compiler.extraction.ExtractedTarget;
import com.qamigrate.compiler.extraction.ExtractedTest;
import com.qamigrate.compiler.extraction.ExtractionResult;
import com.qamigrate.compiler.extraction.IrExtractor;
import com.qamigrate.compiler.extraction.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IrExtractorTest {

    private static final String LOGIN_FLOW = """
            @Tag("auth")
            class LoginFlowTest {
                private By emailInput = By.id("email");
                private By passwordInput = By.id("password");
                private By loginButton = By.id("login");

                @Test
                @Tag("smoke")
                @Tag("auth")
                @DisplayName("User logs in")
                void logsIn(WebDriver driver) {
                    driver.findElement(emailInput).sendKeys("jane@example.com");
                    driver.findElement(passwordInput).sendKeys("secret");
                    driver.findElement(loginButton).click();
                    assertEquals("Dashboard", driver.getTitle());
                }

                static class Nested {
                    @Test
                    void inner() { }
                }
            }
            """;

    private final IrExtractor extractor = new IrExtractor();

    @Test
    void stepsResolveToLocatorsInCallOrder() {
        ExtractionResult result = extractor.extract(AstFixtures.parse(LOGIN_FLOW), "shop", "java");

        ExtractedTest test = result.tests().get(0);
        assertEquals("logsIn", test.name());
        List<ExtractedStep> steps = test.steps();
        assertEquals(4, steps.size());

        assertStep(steps.get(0), StepKind.ACTION, "sendKeys", "emailInput", Map.of("value", "jane@example.com"));
        assertStep(steps.get(1), StepKind.ACTION, "sendKeys", "passwordInput", Map.of("value", "secret"));
        assertStep(steps.get(2), StepKind.ACTION, "click", "loginButton", Map.of());
        assertStep(steps.get(3), StepKind.ASSERTION, "assertEquals", null, Map.of());
        for (ExtractedStep step : steps.subList(0, 3)) {
            assertNotNull(step.targetNodeId());
        }
    }

    @Test
    void testMetadataMergesSuiteTags() {
        ExtractionResult result = extractor.extract(AstFixtures.parse(LOGIN_FLOW), "shop", "java");
        ExtractedTest test = result.tests().get(0);

        assertEquals(List.of("auth", "smoke"), test.tags());
        assertEquals("User logs in", test.description());
        assertEquals("LoginFlowTest", test.suiteName());
        assertNull(test.dataSource());
        assertNull(test.environmentId());
    }

    @Test
    void nestedClassesBecomeChildSuites() {
        ExtractionResult result = extractor.extract(AstFixtures.parse(LOGIN_FLOW), "shop", "java");

        List<ExtractedSuite> suites = result.suites();
        assertEquals(2, suites.size());
        assertEquals("LoginFlowTest", suites.get(0).name());
        assertEquals(List.of("logsIn"), suites.get(0).tests());
        assertNull(suites.get(0).parentName());
        assertEquals(List.of("auth"), suites.get(0).tags());

        assertEquals("Nested", suites.get(1).name());
        assertEquals("LoginFlowTest", suites.get(1).parentName());
        assertEquals(List.of("inner"), suites.get(1).tests());
        assertEquals("Nested", result.tests().get(1).suiteName());
    }

    @Test
    void pagesPrecedeLocatorsInTargets() {
        AstTree tree = AstFixtures.parse(LOGIN_FLOW);
        ExtractionResult result = extractor.extract(tree, "shop", "java");

        List<ExtractedTarget> targets = result.targets();
        assertEquals(List.of("LoginFlowTest", "Nested", "emailInput", "passwordInput", "loginButton"),
                targets.stream().map(ExtractedTarget::name).toList());
        assertFalse(targets.get(0).isLocator());
        assertTrue(targets.get(2).isLocator());

        AstNode emailLocator = tree.walk().stream()
                .filter(n -> n.getId().equals(targets.get(2).nodeId()))
                .findFirst().orElseThrow();
        assertEquals("id", emailLocator.property("member"));
        assertEquals("Inline.java", result.filePath());
        assertEquals("shop", result.projectName());
        assertTrue(result.environments().isEmpty());
    }

    @Test
    void extractionIsRepeatable() {
        ExtractionResult first = extractor.extract(AstFixtures.parse(LOGIN_FLOW), "shop", "java");
        ExtractionResult second = extractor.extract(AstFixtures.parse(LOGIN_FLOW), "shop", "java");
        assertEquals(first, second);
    }

    @Test
    void tagListsAreTrimmedAndDistinct() {
        AstTree tree = AstFixtures.parse("""
                class Groups {
                    @Test(groups = {"smoke", " regression ", "smoke"})
                    void run() { }
                }
                """);
        ExtractedTest test = extractor.extract(tree, "shop", "java").tests().get(0);
        assertEquals(List.of("smoke", "regression"), test.tags());
    }

    private static void assertStep(ExtractedStep step, StepKind kind, String name, String target,
                                   Map<String, String> parameters) {
        assertEquals(kind, step.kind());
        assertEquals(name, step.name());
        assertEquals(target, step.targetNameId());
        assertEquals(parameters, step.parameters());
    }
}
