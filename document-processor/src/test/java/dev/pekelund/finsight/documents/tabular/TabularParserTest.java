package dev.pekelund.finsight.documents.tabular;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class TabularParserTest {

    private final TabularParser parser = new TabularParser();

    @Test
    void parsesHeadersAndRowsKeyedByHeader() {
        String csv = """
            Employee Name,Job Title,Annual Salary
            John Smith,Developer,"$95,000"
            Jane Doe,Designer,88000
            """;

        TabularParseResult result = parser.parse(csv);

        assertThat(result.headers()).containsExactly("Employee Name", "Job Title", "Annual Salary");
        assertThat(result.rows()).hasSize(2);
        assertThat(result.rows().get(0))
            .containsEntry("Employee Name", "John Smith")
            .containsEntry("Annual Salary", "$95,000");
        assertThat(result.totalRowCount()).isEqualTo(2);
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    void stripsByteOrderMarkAndPadsShortRows() {
        byte[] content = "\uFEFFName,Role,Department\nJohn,Dev\n".getBytes(StandardCharsets.UTF_8);

        TabularParseResult result = parser.parse(content);

        assertThat(result.headers()).containsExactly("Name", "Role", "Department");
        assertThat(result.rows().get(0)).containsEntry("Department", "");
    }

    @Test
    void skipsBlankLines() {
        TabularParseResult result = parser.parse("Name,Role\n\nJohn,Dev\n\n");

        assertThat(result.rows()).hasSize(1);
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> parser.parse(new byte[0]))
            .isInstanceOf(TabularParseException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> parser.parse("   "))
            .isInstanceOf(TabularParseException.class);
    }

    @Test
    void rejectsDuplicateHeaders() {
        assertThatThrownBy(() -> parser.parse("Name,Role,Name\nJohn,Dev,John\n"))
            .isInstanceOf(TabularParseException.class);
    }

    @Test
    void rejectsBlankHeader() {
        assertThatThrownBy(() -> parser.parse("Name,,Role\nJohn,x,Dev\n"))
            .isInstanceOf(TabularParseException.class)
            .hasMessageContaining("Column 2");
    }

    @Test
    void previewKeepsTotalRowCount() {
        TabularParseResult result = parser.parse("Name\nA\nB\nC\n");

        TabularParseResult preview = result.preview(2);

        assertThat(preview.rows()).hasSize(2);
        assertThat(preview.totalRowCount()).isEqualTo(3);
        assertThat(preview.isTruncated()).isTrue();
        assertThat(result.preview(10)).isSameAs(result);
    }
}
