package com.goerdes.embercsv;

import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EmberCsvApplicationTest {

    @Test
    void inputRunsStartWithoutWebServer() {
        assertEquals(WebApplicationType.NONE, EmberCsvApplication.webApplicationType("--input=train_features_0.jsonl"));
        assertEquals(WebApplicationType.NONE,
                EmberCsvApplication.webApplicationType("--input=a.jsonl", "--input=b.jsonl", "--server.port=0"));
    }

    @Test
    void otherwiseServesHttp() {
        assertEquals(WebApplicationType.SERVLET, EmberCsvApplication.webApplicationType());
        assertEquals(WebApplicationType.SERVLET, EmberCsvApplication.webApplicationType("--server.port=8081"));
        assertEquals(WebApplicationType.SERVLET, EmberCsvApplication.webApplicationType("input.jsonl"));
    }
}
