package club.ppmc.filespace.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.filespace.exception.InvalidNameException;
import org.junit.jupiter.api.Test;

class NodeNamesTest {

    @Test
    void acceptsOrdinaryNames() {
        assertThatCode(() -> NodeNames.validate("report final.pdf")).doesNotThrowAnyException();
        assertThatCode(() -> NodeNames.validate("..")).doesNotThrowAnyException();
    }

    @Test
    void rejectsEmptySeparatorAndNullByte() {
        assertThatThrownBy(() -> NodeNames.validate("")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> NodeNames.validate(null)).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> NodeNames.validate("a/b")).isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> NodeNames.validate("a\0b")).isInstanceOf(InvalidNameException.class);
    }

    @Test
    void sanitizeKeepsOnlySafeCharacters() {
        assertThat(NodeNames.sanitize("  my report (v2).pdf ")).isEqualTo("my_report_v2.pdf");
        assertThat(NodeNames.sanitize("../../etc/passwd")).isEqualTo("passwd");
        assertThat(NodeNames.sanitize("C:\\Users\\me\\notes.txt")).isEqualTo("notes.txt");
    }

    @Test
    void rejectsNamesLongerThanColumn() {
        assertThatCode(() -> NodeNames.validate("n".repeat(NodeNames.MAX_LENGTH))).doesNotThrowAnyException();
        assertThatThrownBy(() -> NodeNames.validate("n".repeat(NodeNames.MAX_LENGTH + 1)))
                .isInstanceOf(InvalidNameException.class);
    }

    @Test
    void sanitizeKeepsUnicodeLettersAndDigits() {
        assertThat(NodeNames.sanitize("报告.pdf")).isEqualTo("报告.pdf");
        assertThat(NodeNames.sanitize("季度 总结 ①.docx")).isEqualTo("季度_总结_.docx");
        assertThat(NodeNames.sanitize("Résumé-2024.txt")).isEqualTo("Résumé-2024.txt");
    }

    @Test
    void sanitizeReturnsNullWhenNothingUsableRemains() {
        assertThat(NodeNames.sanitize(null)).isNull();
        assertThat(NodeNames.sanitize("")).isNull();
        assertThat(NodeNames.sanitize("///")).isNull();
        assertThat(NodeNames.sanitize("..")).isNull();
        assertThat(NodeNames.sanitize("★☆")).isNull();
    }

    @Test
    void numberedInsertsCounterBeforeExtension() {
        assertThat(NodeNames.numbered("report.pdf", 2)).isEqualTo("report (2).pdf");
        assertThat(NodeNames.numbered("archive.tar.gz", 3)).isEqualTo("archive.tar (3).gz");
        assertThat(NodeNames.numbered("README", 2)).isEqualTo("README (2)");
        assertThat(NodeNames.numbered(".env", 2)).isEqualTo(".env (2)");
    }
}
