package com.motaz.triage.services;

import com.motaz.triage.exception.SchemaMismatchException;
import com.motaz.triage.scoring.TabularData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabularFileParserTest {

    private final TabularFileParser parser = new TabularFileParser();

    @Test
    @DisplayName("Should split header and rows, keeping quoted commas inside a cell")
    void shouldParseCsv() {
        TabularData table = parser.parse(csv("processName,args,userId\nsshd,\"-D, -f\",0\nbash,,1000\n"));

        assertThat(table.getHeader()).containsExactly("processName", "args", "userId");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.getRows().get(0)).containsExactly("sshd", "-D, -f", "0");
        assertThat(table.getRows().get(1)).containsExactly("bash", "", "1000");
    }

    @Test
    @DisplayName("Should strip a UTF-8 byte order mark from the first header cell")
    void shouldStripBom() {
        TabularData table = parser.parse(csv("\uFEFFamount,channel\n1,web\n"));

        assertThat(table.getHeader().get(0)).isEqualTo("amount");
    }

    @Test
    @DisplayName("Should accept a header without data rows")
    void shouldAcceptHeaderOnly() {
        TabularData table = parser.parse(csv("amount,channel\n"));

        assertThat(table.getHeader()).containsExactly("amount", "channel");
        assertThat(table.getRows()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an empty file")
    void shouldRejectEmptyFile() {
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(SchemaMismatchException.class);
    }

    // ---- Helpers

    private static byte[] csv(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
