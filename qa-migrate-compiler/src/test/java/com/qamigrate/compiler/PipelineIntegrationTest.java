package com.qamigrate.compiler;

import com.qamigrate.compiler.frontend.JavaSourceParser;
import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.IrDocument;
import com.qamigrate.compiler.ir.IrModel.StepIr;
import com.qamigrate.compiler.ir.IrModel.TargetIr;
import com.qamigrate.compiler.ir.IrModel.TestIr;
import com.qamigrate.compiler.ir.IrWriter;
import com.qamigrate.compiler.manifest.CompilerManifest;
import com.qamigrate.compiler.manifest.ManifestReader;
import com.qamigrate.compiler.pipeline.IrGenerationPipeline;
import com.qamigrate.compiler.pipeline.PipelineResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the full pipeline over the ecommerce-selenium fixture project.
 */
class PipelineIntegrationTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static CompilerManifest manifest;
    private static PipelineResult result;
    private static IrDocument doc;

    @BeforeAll
    static void compileFixture() {
        manifest = new ManifestReader().read(AstFixtures.ECOMMERCE_FIXTURE.resolve("manifest.json"));
        result = IrGenerationPipeline.forJava(FIXED).run(manifest, AstFixtures.ECOMMERCE_FIXTURE);
        doc = result.document();
    }

    @Test
    void filesAreProcessedInSortedOrder() {
        List<String> names = result.sourceFiles().stream()
                .map(p -> p.getFileName().toString())
                .toList();
        assertEquals(List.of("CheckoutPage.java", "LoginPage.java", "CheckoutTest.java", "LoginTest.java"), names);
        assertEquals("src/test/java/com/shop/pages/CheckoutPage.java", result.extractions().get(0).filePath());
    }

    @Test
    void projectSummary() {
        assertEquals(IrIds.project("ecommerce-selenium"), doc.project().id());
        assertEquals("2024-05-01T12:00:00Z", doc.project().metadata().generatedAt());
        assertEquals(List.of("CheckoutPage", "LoginPage", "CheckoutTest", "LoginTest"), doc.project().suites());
        assertEquals(List.of("placeOrder", "orderRequiresTerms", "loginWithValidCredentials",
                "loginRejectsInvalidCredentials"), doc.project().tests());
        assertEquals(List.of("staging", "production"), doc.project().environments());
        assertEquals(14, doc.targets().size());
        assertEquals(2, doc.data().size());
    }

    @Test
    void pageObjectCallsLinkToLocatorsInOtherFiles() {
        TestIr login = test("loginWithValidCredentials");

        assertEquals(List.of("enterEmail", "enterPassword", "clickLogin", "assertEquals"), stepNames(login));
        assertEquals(target("emailInput").id(), login.steps().get(0).targetId());
        assertEquals(Map.of("value", "jane@example.com"), login.steps().get(0).parameters());
        assertEquals(target("passwordInput").id(), login.steps().get(1).targetId());
        assertEquals(target("loginButton").id(), login.steps().get(2).targetId());
        assertEquals("assertion", login.steps().get(3).kind());

        assertEquals(IrIds.suite("LoginTest"), login.suiteId());
        assertEquals(IrIds.environment("staging"), login.environmentId());
        assertEquals(List.of("auth", "smoke"), login.tags());
        assertEquals("Registered user can log in", login.description());
        assertNull(login.dataId());
    }

    @Test
    void parameterizedTestUsesReferencesAndDataSet() {
        TestIr rejects = test("loginRejectsInvalidCredentials");

        assertEquals(List.of("enterEmail", "enterPassword", "clickLogin", "errorText", "assertTrue"),
                stepNames(rejects));
        assertEquals(Map.of("reference", "email"), rejects.steps().get(0).parameters());
        assertNull(rejects.steps().get(3).targetId());
        assertEquals(IrIds.data("invalidCredentials"), rejects.dataId());
    }

    @Test
    void testNgSuiteIsExtracted() {
        TestIr placeOrder = test("placeOrder");

        assertEquals(List.of("selectCountry", "enterCardNumber", "checkTerms", "clickPlaceOrder", "assertTrue"),
                stepNames(placeOrder));
        assertEquals(List.of("checkout", "smoke"), placeOrder.tags());
        assertEquals("Guest places an order", placeOrder.description());
        assertEquals(IrIds.data("shippingCountries"), placeOrder.dataId());
        assertEquals(target("countrySelect").id(), placeOrder.steps().get(0).targetId());
        assertEquals(target("placeOrderButton").id(), placeOrder.steps().get(3).targetId());
    }

    @Test
    void inlineLocatorsAreKeptButOnlyNamedOnesLink() {
        TestIr terms = test("orderRequiresTerms");

        assertEquals(List.of("enterCardNumber", "click", "getText", "assertEquals", "assertEquals"),
                stepNames(terms));

        StepIr click = terms.steps().get(1);
        assertEquals("cssSelector", click.targetNameId());
        assertNotNull(click.targetNodeId());
        assertNull(click.targetId());

        StepIr getText = terms.steps().get(2);
        assertEquals("error", getText.targetNameId());
        assertEquals(target("error").id(), getText.targetId());
    }

    @Test
    void locatorTargetsCarryPageAndSelector() {
        TargetIr card = target("cardNumberInput");

        assertEquals("CheckoutPage", card.context().page());
        assertEquals("xpath", card.preferredStrategy());
        assertEquals("//input[@placeholder='Card Number']", card.selectorStrategies().get(0).value());
        assertEquals("textbox", card.semantic().role());
        assertEquals("src/test/java/com/shop/pages/CheckoutPage.java", card.sourceFile());

        assertEquals("css", target("passwordInput").preferredStrategy());
    }

    @Test
    void environmentsComeFromManifest() {
        assertEquals(List.of("staging", "production"),
                doc.environments().stream().map(e -> e.name()).toList());
        assertEquals(Integer.valueOf(5), doc.environments().get(0).timeouts().implicit());
        assertEquals(2, doc.environments().get(0).retryPolicy().maxRetries());
        assertEquals("local", doc.environments().get(1).executionMode());
    }

    @Test
    void suitesListTheirTests() {
        Map<String, List<String>> testsBySuite = doc.suites().stream()
                .collect(Collectors.toMap(s -> s.name(), s -> s.tests()));
        assertEquals(List.of(IrIds.test("loginWithValidCredentials"), IrIds.test("loginRejectsInvalidCredentials")),
                testsBySuite.get("LoginTest"));
        assertTrue(testsBySuite.get("LoginPage").isEmpty());
    }

    @Test
    void repeatedRunsWriteIdenticalFiles(@TempDir Path tempDir) throws IOException {
        Path first = tempDir.resolve("first.json");
        Path second = tempDir.resolve("second.json");
        IrWriter writer = new IrWriter();

        writer.write(first, IrGenerationPipeline.forJava(FIXED).run(manifest, AstFixtures.ECOMMERCE_FIXTURE).document());
        writer.write(second, IrGenerationPipeline.forJava(FIXED).run(manifest, AstFixtures.ECOMMERCE_FIXTURE).document());

        assertEquals(-1L, Files.mismatch(first, second));
    }

    @Test
    void syntaxErrorAbortsTheRun(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("manifest.json"), "{\"project_name\": \"broken\", \"source_roots\": [\"tests\"]}");
        Path tests = Files.createDirectories(tempDir.resolve("tests"));
        Files.writeString(tests.resolve("Good.java"), "class Good { @Test void ok() { } }\n");
        Files.writeString(tests.resolve("Broken.java"), "class Broken { void x( }\n");

        CompilerManifest broken = new ManifestReader().read(tempDir.resolve("manifest.json"));
        JavaSourceParser.SourceParseException e = assertThrows(JavaSourceParser.SourceParseException.class,
                () -> IrGenerationPipeline.forJava(FIXED).run(broken, tempDir));
        assertTrue(e.getMessage().contains("Broken.java"), e.getMessage());
    }

    private static TestIr test(String name) {
        return doc.tests().stream().filter(t -> t.name().equals(name)).findFirst().orElseThrow();
    }

    private static TargetIr target(String name) {
        return doc.targets().stream().filter(t -> t.name().equals(name)).findFirst().orElseThrow();
    }

    private static List<String> stepNames(TestIr test) {
        return test.steps().stream().map(StepIr::name).toList();
    }
}
