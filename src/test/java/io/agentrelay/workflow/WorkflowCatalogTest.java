package io.agentrelay.workflow;

import io.agentrelay.model.ResponseStatus;
import io.agentrelay.model.StepRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class WorkflowCatalogTest {

    @Test
    void projectInitializationChainsPlanRisksAndReport() {
        WorkflowDefinition definition = WorkflowCatalog.withDefaults().find(WorkflowCatalog.PROJECT_INITIALIZATION).orElseThrow();

        Assertions.assertEquals(List.of("generate_plan", "assess_risks", "generate_report"), definition.stepNames());
        Assertions.assertEquals("status_reporter_agent", definition.steps().get(2).agentId());

        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        results.put("generate_plan", Map.of("plan", "p-1"));
        Map<String, Object> reportInput = definition.steps().get(2).inputMapping().map(results, Map.of());
        Assertions.assertEquals(Map.of("plan", "p-1", "risks", List.of()), reportInput);
    }

    @Test
    void listsWorkflowsSortedByType() {
        WorkflowCatalog catalog = WorkflowCatalog.withDefaults();
        catalog.register(new WorkflowDefinition("audit", List.of(WorkflowStep.of("scan", "scanner"))));

        Assertions.assertEquals(List.of("audit", WorkflowCatalog.PROJECT_INITIALIZATION),
                catalog.list().stream().map(WorkflowDefinition::type).toList());
        Assertions.assertTrue(catalog.contains("audit"));
        Assertions.assertFalse(catalog.contains(null));
        Assertions.assertTrue(catalog.find("missing").isEmpty());
    }

    @Test
    void definitionsRejectEmptyOrDuplicateSteps() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new WorkflowDefinition("empty", List.of()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new WorkflowDefinition("dup", List.of(
                WorkflowStep.of("a", "x"),
                WorkflowStep.of("a", "y")
        )));
        Assertions.assertThrows(IllegalArgumentException.class, () -> WorkflowStep.of("a", " "));
    }

    @Test
    void sealedLedgerRefusesLateEntries() {
        WorkflowLedger ledger = new WorkflowLedger();
        Assertions.assertTrue(ledger.append(new StepRecord("a", ResponseStatus.SUCCESS, Map.of("n", 1))));

        List<StepRecord> sealed = ledger.seal();

        Assertions.assertFalse(ledger.append(new StepRecord("b", ResponseStatus.SUCCESS, Map.of())));
        Assertions.assertEquals(1, sealed.size());
        Assertions.assertEquals(1, ledger.size());
        Assertions.assertTrue(ledger.isSealed());
        Assertions.assertEquals("a", ledger.snapshot().get(0).step());
    }
}
