package com.chirpy.api.chirps;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProfanityFilterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', textBlock = """
            ''                                  | ''
            Hello, world!                       | Hello, world!
            This is a test with a Kerfuffle.    | This is a test with a ****.
            No bad words here.                  | No bad words here.
            Another sharbert in the text.       | Another **** in the text.
            fornax and Fornax                   | **** and ****
            SHARBERT stays                      | SHARBERT stays
            """)
    void clean(String input, String expected) {
        assertThat(ProfanityFilter.clean(input)).isEqualTo(expected);
    }
}
