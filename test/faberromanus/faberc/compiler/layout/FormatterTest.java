package faberromanus.faberc.compiler.layout;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Options;

class FormatterTest {

    /** Formats whitespace separated words as a list. */
    private static class WordPlugin implements FormatterPlugin<List<String>> {

        private final boolean closingLine;

        private WordPlugin(boolean closingLine) {
            this.closingLine = closingLine;
        }

        @Override
        public List<String> parse(String fileName, String text) {
            List<String> words = new ArrayList<>();
            for(String word: text.strip().split("\\s+")) {
                if(!word.isEmpty()) { words.add(word); }
            }
            return words;
        }

        @Override
        public Doc print(List<String> root) {
            List<Doc> words = new ArrayList<>();
            for(String word: root) {
                words.add(Doc.text(word));
            }
            Doc list = Doc.group(Doc.indent(
                Doc.join(Doc.concat(Doc.text(","), Doc.LINE), words)
            ));
            return this.closingLine? Doc.concat(list, Doc.HARDLINE) : list;
        }

        @Override
        public int locStart(List<String> node) {
            return 0;
        }

        @Override
        public int locEnd(List<String> node) {
            return node.size();
        }

    }

    @Test
    void endsTheOutputWithASingleLineBreak() throws ErrorException {
        Formatter<List<String>> open = new Formatter<>(
            new WordPlugin(false), Options.DEFAULT
        );
        Formatter<List<String>> closed = new Formatter<>(
            new WordPlugin(true), Options.DEFAULT
        );
        assertThat(open.format("words", "a  b\nc")).isEqualTo("a, b, c\n");
        assertThat(closed.format("words", "a  b\nc")).isEqualTo("a, b, c\n");
    }

    @Test
    void breaksAtThePrintWidth() throws ErrorException {
        Formatter<List<String>> formatter = new Formatter<>(
            new WordPlugin(false),
            Options.DEFAULT.withPrintWidth(6).withIndent(Options.spaces(2))
        );
        assertThat(formatter.format("words", "alpha beta"))
            .isEqualTo("alpha,\n  beta\n");
    }

}
