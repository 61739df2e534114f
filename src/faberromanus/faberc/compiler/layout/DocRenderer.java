package faberromanus.faberc.compiler.layout;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Lays out documents within a maximum line width. A group is printed on
 * a single line if its content and everything up to the next possible
 * line break fit into the remaining width, and with all of its direct
 * line breaks taken otherwise.
 */
public class DocRenderer {

    private static record Command(int level, boolean flat, Doc doc) {}

    private final int width;
    private final String indentUnit;

    public DocRenderer(int width, String indentUnit) {
        this.width = width;
        this.indentUnit = indentUnit;
    }

    public String render(Doc doc) {
        StringBuilder out = new StringBuilder();
        Deque<Command> stack = new ArrayDeque<>();
        stack.push(new Command(0, false, doc));
        int column = 0;
        while(!stack.isEmpty()) {
            Command command = stack.pop();
            Doc current = command.doc();
            switch(current.type) {
                case TEXT: {
                    String text = current.<Doc.Text>getValue().text();
                    out.append(text);
                    int lastBreak = text.lastIndexOf('\n');
                    column = lastBreak == -1
                        ? column + text.length()
                        : text.length() - lastBreak - 1;
                } break;
                case LINE:
                case SOFTLINE: {
                    if(command.flat()) {
                        if(current.type == Doc.Type.LINE) {
                            out.append(" ");
                            column += 1;
                        }
                        break;
                    }
                    column = this.newline(out, command.level());
                } break;
                case HARDLINE: {
                    column = this.newline(out, command.level());
                } break;
                case INDENT: {
                    stack.push(new Command(
                        command.level() + 1, command.flat(),
                        current.<Doc.Nested>getValue().content()
                    ));
                } break;
                case GROUP: {
                    Doc content = current.<Doc.Nested>getValue().content();
                    boolean flat = command.flat() || (
                        !content.hasHardline()
                            && this.fits(
                                this.width - column,
                                new Command(command.level(), true, content),
                                stack
                            )
                    );
                    stack.push(new Command(command.level(), flat, content));
                } break;
                case CONCAT: {
                    List<Doc> parts = current.<Doc.Concat>getValue().parts();
                    for(int i = parts.size() - 1; i >= 0; i -= 1) {
                        stack.push(new Command(
                            command.level(), command.flat(), parts.get(i)
                        ));
                    }
                } break;
                default: {
                    throw new IllegalStateException("unhandled doc type!");
                }
            }
        }
        return out.toString();
    }

    private int newline(StringBuilder out, int level) {
        int end = out.length();
        while(end > 0 && (out.charAt(end - 1) == ' '
                || out.charAt(end - 1) == '\t')) {
            end -= 1;
        }
        out.setLength(end);
        out.append("\n");
        String indentation = this.indentUnit.repeat(level);
        out.append(indentation);
        return indentation.length();
    }

    /**
     * Checks whether the given command printed flat, followed by the
     * pending commands up to their first line break, fits into the
     * remaining width.
     */
    private boolean fits(int remaining, Command first, Deque<Command> rest) {
        Deque<Command> pending = new ArrayDeque<>();
        pending.push(first);
        Iterator<Command> restIter = rest.iterator();
        while(remaining >= 0) {
            if(pending.isEmpty()) {
                if(!restIter.hasNext()) { return true; }
                pending.push(restIter.next());
            }
            Command command = pending.pop();
            Doc current = command.doc();
            switch(current.type) {
                case TEXT: {
                    String text = current.<Doc.Text>getValue().text();
                    int firstBreak = text.indexOf('\n');
                    if(firstBreak != -1) { return remaining >= firstBreak; }
                    remaining -= text.length();
                } break;
                case LINE:
                    if(!command.flat()) { return true; }
                    remaining -= 1;
                    break;
                case SOFTLINE:
                    if(!command.flat()) { return true; }
                    break;
                case HARDLINE:
                    return true;
                case INDENT:
                case GROUP:
                    pending.push(new Command(
                        command.level(), command.flat(),
                        current.<Doc.Nested>getValue().content()
                    ));
                    break;
                case CONCAT: {
                    List<Doc> parts = current.<Doc.Concat>getValue().parts();
                    for(int i = parts.size() - 1; i >= 0; i -= 1) {
                        pending.push(new Command(
                            command.level(), command.flat(), parts.get(i)
                        ));
                    }
                } break;
                default:
                    throw new IllegalStateException("unhandled doc type!");
            }
        }
        return false;
    }

}
