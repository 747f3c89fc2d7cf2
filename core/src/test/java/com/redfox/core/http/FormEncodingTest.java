package com.redfox.core.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormEncodingTest {

    @Test
    void spacesBecomePlusAndReservedAreEscaped() {
        assertThat(FormEncoding.quotePlus("user=fox&pw=a b/c")).isEqualTo("user%3Dfox%26pw%3Da+b%2Fc");
    }

    @Test
    void tildeStaysAndStarIsEscaped() {
        assertThat(FormEncoding.quotePlus("~a*b-_.")).isEqualTo("~a%2Ab-_.");
    }

    @Test
    void emptyAndNullGiveEmpty() {
        assertThat(FormEncoding.quotePlus("")).isEmpty();
        assertThat(FormEncoding.quotePlus(null)).isEmpty();
    }
}
