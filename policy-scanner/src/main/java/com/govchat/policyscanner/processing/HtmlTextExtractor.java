package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeVisitor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Visible text of an HTML page, one line per block element. Scripts, styles
 * and page chrome (nav, header, footer) are removed first.
 */
@Slf4j
public class HtmlTextExtractor implements TextExtractor {

    private static final String NON_CONTENT = "script, style, nav, header, footer";

    @Override
    public DocumentType supportedType() {
        return DocumentType.HTML;
    }

    @Override
    public ExtractedText extract(Path file) throws IOException {
        Document document = Jsoup.parse(file.toFile(), "UTF-8");
        document.select(NON_CONTENT).remove();

        StringBuilder text = new StringBuilder();
        document.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    text.append(textNode.text());
                } else if (node instanceof Element element && "br".equals(element.normalName())) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    text.append('\n');
                }
            }
        });

        if (text.toString().isBlank()) {
            throw new ProcessingException("No text could be extracted from HTML");
        }
        log.debug("Extracted {} characters from HTML", text.length());
        return new ExtractedText(text.toString(), null);
    }
}
