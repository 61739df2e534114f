package faberromanus.faberc.compiler.layout;

import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.Options;

public class Formatter<N> {

    private static final Logger LOGGER = Logger.getLogger(
        Formatter.class.getName()
    );

    private final FormatterPlugin<N> plugin;
    private final DocRenderer renderer;

    public Formatter(FormatterPlugin<N> plugin, Options options) {
        this.plugin = plugin;
        this.renderer = new DocRenderer(options.printWidth(), options.indent());
    }

    public String format(String fileName, String text) throws ErrorException {
        N root = this.plugin.parse(fileName, text);
        return this.print(root);
    }

    public String print(N root) {
        Doc doc = this.plugin.print(root);
        String output = this.renderer.render(doc);
        LOGGER.log(Level.FINE, "Formatted {0} characters of source",
            this.plugin.locEnd(root) - this.plugin.locStart(root));
        return output.endsWith("\n")? output : output + "\n";
    }

}
