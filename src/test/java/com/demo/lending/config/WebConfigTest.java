package com.demo.lending.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebConfigTest {

    @Test
    void blankMeansNoCrossOriginAccess() {
        assertThat(WebConfig.parseOrigins("")).isEmpty();
        assertThat(WebConfig.parseOrigins(" , ")).isEmpty();
        assertThat(WebConfig.parseOrigins(null)).isEmpty();
    }

    @Test
    void originsAreTrimmedAndDeduplicated() {
        assertThat(WebConfig.parseOrigins("https://app.example/, https://app.example ,http://localhost:5173"))
                .containsExactly("https://app.example", "http://localhost:5173");
    }
}
