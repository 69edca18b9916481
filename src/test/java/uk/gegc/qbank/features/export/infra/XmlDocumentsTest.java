package uk.gegc.qbank.features.export.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.assertThat;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("XmlDocuments Tests")
class XmlDocumentsTest {

    @Test
    @DisplayName("stripInvalidChars: keeps tab, line feed and carriage return, drops other control characters")
    void stripInvalidChars_keepsWhitespaceControls() {
        assertThat(XmlDocuments.stripInvalidChars("a\u0000b\tc\nd\re\u0007f\u007Fg"))
                .isEqualTo("ab\tc\nd\refg");
    }

    @Test
    @DisplayName("stripInvalidChars: returns clean and empty input unchanged")
    void stripInvalidChars_cleanInput() {
        assertThat(XmlDocuments.stripInvalidChars("x^2 é 𝑥")).isEqualTo("x^2 é 𝑥");
        assertThat(XmlDocuments.stripInvalidChars("")).isEmpty();
        assertThat(XmlDocuments.stripInvalidChars(null)).isNull();
    }

    @Test
    @DisplayName("serialize: document with control characters in text and attributes parses back")
    void serialize_controlCharacters_parsesBack() throws Exception {
        // Given
        Document document = XmlDocuments.newDocument();
        Element root = document.createElement("root");
        root.setAttribute("title", "Quiz\u0002 1");
        root.setTextContent("Hello\u0001world");
        document.appendChild(root);

        // When
        Document parsed = XmlDocuments.parse(XmlDocuments.serialize(document));

        // Then
        assertThat(parsed.getDocumentElement().getAttribute("title")).isEqualTo("Quiz 1");
        assertThat(parsed.getDocumentElement().getTextContent()).isEqualTo("Helloworld");
    }
}
