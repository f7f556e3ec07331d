package com.trialwatch.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.trialwatch.model.DatePrecision;
import com.trialwatch.model.PartialDate;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PartialDateParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fullDateKeepsDayPrecision() {
        PartialDate date = PartialDateParser.parse("2024-09-30");

        assertThat(date.value()).isEqualTo(LocalDate.of(2024, 9, 30));
        assertThat(date.precision()).isEqualTo(DatePrecision.DAY);
        assertThat(date.raw()).isEqualTo("2024-09-30");
    }

    @Test
    void monthOnlyAnchorsToFifteenth() {
        PartialDate date = PartialDateParser.parse("2024-09");

        assertThat(date.value()).isEqualTo(LocalDate.of(2024, 9, 15));
        assertThat(date.precision()).isEqualTo(DatePrecision.MONTH);
    }

    @Test
    void yearOnlyAnchorsToJulyFirst() {
        PartialDate date = PartialDateParser.parse("2025");

        assertThat(date.value()).isEqualTo(LocalDate.of(2025, 7, 1));
        assertThat(date.precision()).isEqualTo(DatePrecision.YEAR);
    }

    @Test
    void surroundingWhitespaceIsStripped() {
        PartialDate date = PartialDateParser.parse("  2024-01-05 ");

        assertThat(date.raw()).isEqualTo("2024-01-05");
        assertThat(date.value()).isEqualTo(LocalDate.of(2024, 1, 5));
    }

    @Test
    void emptyAndNullYieldNone() {
        assertThat(PartialDateParser.parse((String) null)).isEqualTo(PartialDate.none());
        assertThat(PartialDateParser.parse("   ")).isEqualTo(PartialDate.none());
        assertThat(PartialDateParser.parse(MissingNode.getInstance())).isEqualTo(PartialDate.none());
        assertThat(PartialDateParser.parse(NullNode.getInstance())).isEqualTo(PartialDate.none());
    }

    @Test
    void garbageKeepsRawButHasNoValue() {
        PartialDate date = PartialDateParser.parse("Sept 2024");

        assertThat(date.raw()).isEqualTo("Sept 2024");
        assertThat(date.value()).isNull();
        assertThat(date.precision()).isEqualTo(DatePrecision.NONE);
    }

    @Test
    void impossibleCalendarDateIsUnparsed() {
        PartialDate date = PartialDateParser.parse("2024-02-30");

        assertThat(date.isResolved()).isFalse();
        assertThat(date.raw()).isEqualTo("2024-02-30");
    }

    @Test
    void yearsOutsideFourDigitRangeAreUnparsed() {
        PartialDate farFuture = PartialDateParser.parse("+11761245-07-01");

        assertThat(farFuture.isResolved()).isFalse();
        assertThat(farFuture.precision()).isEqualTo(DatePrecision.NONE);
        assertThat(farFuture.raw()).isEqualTo("+11761245-07-01");
        assertThat(PartialDateParser.parse("10000").isResolved()).isFalse();
        assertThat(PartialDateParser.parse("0000-05").isResolved()).isFalse();
        assertThat(PartialDateParser.parse("9999-12-31").value()).isEqualTo(LocalDate.of(9999, 12, 31));
    }

    @Test
    void dateStructIsUnwrapped() throws Exception {
        PartialDate date = PartialDateParser.parse(mapper.readTree("{\"date\": \"2023-11\", \"type\": \"ACTUAL\"}"));

        assertThat(date.value()).isEqualTo(LocalDate.of(2023, 11, 15));
        assertThat(date.precision()).isEqualTo(DatePrecision.MONTH);
    }
}
