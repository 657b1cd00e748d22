package in.alphamine.application.service;

import in.alphamine.application.port.output.ExpressionGenerator;
import in.alphamine.application.port.output.GenerationContext;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.service.validation.ExpressionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GenerationService.
 */
@ExtendWith(MockitoExtension.class)
class GenerationServiceTest {

    @Mock
    private ExpressionGenerator generator;

    @Mock
    private CatalogCache catalog;

    @Mock
    private BatchSimulationOrchestrator orchestrator;

    private GenerationService service;

    @BeforeEach
    void setUp() {
        service = new GenerationService(generator, catalog, new ExpressionValidator(), orchestrator);
    }

    @Test
    void testInvalidExpressionsAreDropped() {
        when(catalog.operatorNames()).thenReturn(List.of("rank", "ts_mean"));
        when(catalog.dataFieldIds("EUR", "TOP1000")).thenReturn(List.of("close", "volume"));
        when(generator.generateExpressions(any(GenerationContext.class)))
            .thenReturn(List.of("rank(close)", "rank(close", "volume", "ts_mean(volume, 20)"));

        List<SimulationRequest> requests = service.generate("EUR", "TOP1000",
            new GenerationService.GenerationRequest("momentum", List.of("close"), "simple", 4));

        assertEquals(List.of("rank(close)", "ts_mean(volume, 20)"),
            requests.stream().map(SimulationRequest::expression).toList());
        assertEquals("EUR", requests.get(0).settings().region());
        assertEquals("TOP1000", requests.get(0).settings().universe());

        ArgumentCaptor<GenerationContext> context = ArgumentCaptor.forClass(GenerationContext.class);
        verify(generator).generateExpressions(context.capture());
        assertEquals("momentum", context.getValue().strategyType());
        assertEquals(List.of("close", "volume"), context.getValue().dataFields());
        assertEquals(4, context.getValue().count());
    }

    @Test
    void testEmptyCatalogFailsFast() {
        when(catalog.operatorNames()).thenReturn(List.of());
        when(catalog.dataFieldIds("USA", "TOP3000")).thenReturn(List.of("close"));

        assertThrows(IllegalStateException.class,
            () -> service.generate("USA", "TOP3000", GenerationService.GenerationRequest.of(5)));
        verifyNoInteractions(generator);
    }

    @Test
    void testGenerateAndTestSimulatesAcceptedExpressions() {
        when(catalog.operatorNames()).thenReturn(List.of("rank"));
        when(catalog.dataFieldIds("USA", "TOP3000")).thenReturn(List.of("close"));
        when(generator.generateExpressions(any(GenerationContext.class))).thenReturn(List.of("rank(close)"));
        BatchResult<SimulationRequest, SimulationResult> empty = new BatchResult<>(List.of());
        when(orchestrator.simulateBatch(anyList(), eq(3))).thenReturn(empty);

        BatchResult<SimulationRequest, SimulationResult> result =
            service.generateAndTest("USA", "TOP3000", GenerationService.GenerationRequest.of(1), 3);

        assertSame(empty, result);
    }
}
