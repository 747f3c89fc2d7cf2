package com.redfox.core.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HttpStatusTableTest {

    @Test
    void knowsTheSixCodes() {
        assertThat(HttpStatusTable.asMap()).containsOnlyKeys(200, 301, 302, 400, 403, 404);
        assertThat(HttpStatusTable.reasonOf(302)).hasValue("Found");
        assertThat(HttpStatusTable.reasonOf(404)).hasValue("Not Found");
    }

    @Test
    void unknownCodeHasNoReason() {
        assertThat(HttpStatusTable.reasonOf(500)).isEmpty();
        assertThat(HttpStatusTable.isKnown(500)).isFalse();
    }
}
