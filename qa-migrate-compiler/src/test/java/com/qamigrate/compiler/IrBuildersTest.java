package com.qamigrate.compiler;

import com.qamigrate.compiler.extraction.ExtractedStep;
import com.qamigrate.compiler.extraction.ExtractedSuite;
import com.qamigrate.compiler.extraction.ExtractedTarget;
import com.qamigrate.compiler.extraction.ExtractedTest;
import com.qamigrate.compiler.extraction.StepKind;
import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel;
import com.qamigrate.compiler.ir.IrModel.ProjectIr;
import com.qamigrate.compiler.ir.IrModel.SuiteIr;
import com.qamigrate.compiler.ir.IrModel.TargetIr;
import com.qamigrate.compiler.ir.IrModel.TestIr;
import com.qamigrate.compiler.ir.builder.ProjectIrBuilder;
import com.qamigrate.compiler.ir.builder.SuiteIrBuilder;
import com.qamigrate.compiler.ir.builder.TargetsIrBuilder;
import com.qamigrate.compiler.ir.builder.TestIrBuilder;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IrBuildersTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void idsAreShortStableHashes() {
        assertEquals("49f586181f44", IrIds.project("ecommerce-selenium"));
        assertEquals("84a5ac937251", IrIds.suite("LoginTest"));
        assertEquals("a3e3ce789e92", IrIds.test("loginWithValidCredentials"));
        assertEquals("0f579c4adf96", IrIds.environment("staging"));
        assertEquals("2145139b1b74", IrIds.data("invalidCredentials"));
        assertEquals("809e6553b6d0", IrIds.target("locator", "emailInput"));
        assertNotEquals(IrIds.suite("Login"), IrIds.test("Login"), "kinds never share ids");
    }

    @Test
    void projectCarriesMetadataFromClock() {
        ProjectIr project = new ProjectIrBuilder(FIXED).build("shop", "java",
                List.of("t1"), List.of("S"), List.of("staging"), "0.1.0");

        assertEquals(IrIds.project("shop"), project.id());
        assertEquals(IrModel.SCHEMA_VERSION, project.schemaVersion());
        assertEquals("2024-05-01T12:00:00Z", project.metadata().generatedAt());
        assertEquals("shop", project.metadata().name());
        assertEquals("1.0.0", project.metadata().version());
        assertEquals("java", project.metadata().sourceLanguage());
        assertEquals("0.1.0", project.metadata().compilerVersion());
        assertEquals(List.of("t1"), project.tests());
        assertEquals(List.of("S"), project.suites());
        assertEquals(List.of("staging"), project.environments());
    }

    @Test
    void suiteLinksParentAndTests() {
        SuiteIr nested = new SuiteIrBuilder().build(
                new ExtractedSuite("Inner", List.of("a", "b"), "Outer", "desc", List.of()));

        assertEquals(IrIds.suite("Inner"), nested.id());
        assertEquals(IrIds.suite("Outer"), nested.parentId());
        assertEquals(List.of(IrIds.test("a"), IrIds.test("b")), nested.tests());
        assertEquals("desc", nested.description());

        SuiteIr top = new SuiteIrBuilder().build(new ExtractedSuite("Outer", List.of(), null, null, List.of()));
        assertNull(top.parentId());
    }

    @Test
    void stepsLinkToTargetsByName() {
        ExtractedTest test = new ExtractedTest("login",
                List.of(
                    new ExtractedStep(StepKind.ACTION, "click", "loginButton", "node_7", Map.of()),
                    new ExtractedStep(StepKind.ACTION, "click", "cssSelector", "node_9", Map.of()),
                    new ExtractedStep(StepKind.ASSERTION, "assertTrue", null, null, Map.of())),
                List.of("smoke"), null, null, "LoginTest", "Logs in");

        TestIr built = new TestIrBuilder().build(test, "suite-id", "env-id", null,
                Map.of("loginButton", "target-1"));

        assertEquals(IrIds.test("login"), built.id());
        assertEquals("Logs in", built.description());
        assertEquals("suite-id", built.suiteId());
        assertEquals("env-id", built.environmentId());
        assertNull(built.dataId());
        assertEquals(List.of("smoke"), built.tags());

        assertEquals("target-1", built.steps().get(0).targetId());
        assertEquals("action", built.steps().get(0).kind());
        assertNull(built.steps().get(1).targetId(), "unknown names stay unlinked");
        assertEquals("cssSelector", built.steps().get(1).targetNameId());
        assertEquals("node_9", built.steps().get(1).targetNodeId());
        assertEquals("assertion", built.steps().get(2).kind());
        assertNull(built.steps().get(2).targetId());
    }

    @Test
    void sameNamedStepsGetDistinctIds() {
        ExtractedStep click = new ExtractedStep(StepKind.ACTION, "click", null, null, Map.of());
        ExtractedTest test = new ExtractedTest("t", List.of(click, click), List.of(), null, null, null, null);

        TestIr built = new TestIrBuilder().build(test, null, null, null, Map.of());
        assertNotEquals(built.steps().get(0).id(), built.steps().get(1).id());
    }

    @Test
    void locatorTargetsAreNormalizedAndScored() {
        TargetsIrBuilder builder = new TargetsIrBuilder();

        TargetIr email = builder.build(new ExtractedTarget(ExtractedTarget.TYPE_LOCATOR, "emailInput", "node_3",
                "cssSelector", "input#email", "LoginPage", "src/LoginPage.java"));
        assertEquals(IrIds.target("locator", "emailInput"), email.id());
        assertEquals("css", email.selectorStrategies().get(0).strategy());
        assertEquals("input#email", email.selectorStrategies().get(0).value());
        assertEquals(0.90, email.selectorStrategies().get(0).stabilityScore(), 1e-9);
        assertEquals("css", email.preferredStrategy());
        assertEquals("textbox", email.semantic().role());
        assertEquals("Email Input", email.semantic().businessName());
        assertEquals("LoginPage", email.context().page());
        assertEquals("src/LoginPage.java", email.sourceFile());

        assertEquals("button", role(builder, "loginBtn", "id"));
        assertEquals("combobox", role(builder, "countryDropdown", "name"));
        assertEquals("checkbox", role(builder, "termsCheckbox", "id"));
        assertEquals("link", role(builder, "helpLink", "linkText"));
        assertEquals("element", role(builder, "errorBanner", "className"));

        TargetIr odd = builder.build(new ExtractedTarget(ExtractedTarget.TYPE_LOCATOR, "node_4", "node_4",
                "shadowRoot", "x", null, "A.java"));
        assertEquals(0.50, odd.selectorStrategies().get(0).stabilityScore(), 1e-9);
        assertEquals(0.98, builder.build(new ExtractedTarget(ExtractedTarget.TYPE_LOCATOR, "a", "n", "id", "a",
                null, "A.java")).selectorStrategies().get(0).stabilityScore(), 1e-9);
        assertEquals(0.65, builder.build(new ExtractedTarget(ExtractedTarget.TYPE_LOCATOR, "b", "n", "xpath", "//b",
                null, "A.java")).selectorStrategies().get(0).stabilityScore(), 1e-9);
    }

    @Test
    void pageTargetsHaveNoSelectors() {
        TargetIr page = new TargetsIrBuilder().build(new ExtractedTarget(ExtractedTarget.TYPE_PAGE, "LoginPage",
                "suite_1", null, null, null, "src/LoginPage.java"));

        assertEquals("page", page.type());
        assertEquals("page", page.semantic().role());
        assertEquals("Login Page", page.semantic().businessName());
        assertEquals("LoginPage", page.context().page());
        assertTrue(page.selectorStrategies().isEmpty());
        assertNull(page.preferredStrategy());
    }

    private static String role(TargetsIrBuilder builder, String name, String strategy) {
        return builder.build(new ExtractedTarget(ExtractedTarget.TYPE_LOCATOR, name, "n", strategy, "v",
                null, "A.java")).semantic().role();
    }
}
