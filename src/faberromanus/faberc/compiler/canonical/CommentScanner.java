package faberromanus.faberc.compiler.canonical;

import java.util.ArrayList;
import java.util.List;

import faberromanus.faberc.compiler.ErrorException;
import faberromanus.faberc.compiler.frontend.Lexer;
import faberromanus.faberc.compiler.frontend.Token;

/**
 * Collects the comments of a source file in the order they appear.
 * Comment markers inside string and template literals are not comments,
 * so the text is scanned with the regular lexer instead of searched.
 */
public class CommentScanner {

    private CommentScanner() {}

    public static List<Comment> scan(
        String fileName, String text
    ) throws ErrorException {
        Lexer lexer = new Lexer(fileName, text);
        List<Comment> comments = new ArrayList<>();
        while(true) {
            Token token = lexer.nextToken();
            switch(token.type) {
                case FILE_END:
                    return comments;
                case COMMENT:
                    comments.add(new Comment(
                        token.content.startsWith("#")
                            ? Comment.Kind.LINE
                            : Comment.Kind.BLOCK,
                        token.content, token.source
                    ));
                    break;
                case DOC_COMMENT:
                    comments.add(new Comment(
                        Comment.Kind.DOC, token.content, token.source
                    ));
                    break;
                default:
                    break;
            }
        }
    }

}
