package com.goerdes.embercsv.api;

import com.goerdes.embercsv.exception.FileProcessingException;
import com.goerdes.embercsv.model.ConversionResult;
import com.goerdes.embercsv.services.JsonlConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversionRunnerTest {

    private final JsonlConversionService service = mock(JsonlConversionService.class);
    private final ConversionRunner runner = new ConversionRunner(service);

    private static ConversionResult result(boolean successful) {
        return new ConversionResult(successful, Paths.get("a.csv"), 1, successful ? 1 : 0, List.of(), "done");
    }

    @Test
    void doesNothingWithoutInput() {
        runner.run(new DefaultApplicationArguments("--server.port=0"));
        verifyNoInteractions(service);
    }

    @Test
    void convertsEveryInput() {
        when(service.convert(any())).thenReturn(result(true));
        runner.run(new DefaultApplicationArguments("--input=a.jsonl", "--input=b.jsonl"));
        verify(service).convert(Paths.get("a.jsonl"));
        verify(service).convert(Paths.get("b.jsonl"));
    }

    @Test
    void stopsAtFirstFailure() {
        when(service.convert(Paths.get("a.jsonl"))).thenReturn(result(false));
        assertThrows(FileProcessingException.class,
                () -> runner.run(new DefaultApplicationArguments("--input=a.jsonl", "--input=b.jsonl")));
        verify(service, never()).convert(Paths.get("b.jsonl"));
    }
}
