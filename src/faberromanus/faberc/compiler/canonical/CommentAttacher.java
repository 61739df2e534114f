package faberromanus.faberc.compiler.canonical;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.frontend.AstNode;

/**
 * Assigns comments to the statements they belong to. A comment is placed
 * in the innermost statement list that surrounds it and then attached
 * to a statement of that list:
 * <ul>
 *   <li>as a trailing comment of the statement ending on the same line
 *       before it,</li>
 *   <li>as a leading comment of the statement it is inside of or that
 *       follows it,</li>
 *   <li>as a dangling comment of the list itself if no statement
 *       follows.</li>
 * </ul>
 */
public class CommentAttacher {

    private static final Logger LOGGER = Logger.getLogger(
        CommentAttacher.class.getName()
    );

    public static class Attached {

        private final Map<AstNode, List<Comment>> leading
            = new IdentityHashMap<>();
        private final Map<AstNode, List<Comment>> trailing
            = new IdentityHashMap<>();
        private final Map<AstNode, List<Comment>> dangling
            = new IdentityHashMap<>();

        public static final Attached NONE = new Attached();

        public List<Comment> leading(AstNode node) {
            return this.leading.getOrDefault(node, List.of());
        }

        public List<Comment> trailing(AstNode node) {
            return this.trailing.getOrDefault(node, List.of());
        }

        public List<Comment> dangling(AstNode node) {
            return this.dangling.getOrDefault(node, List.of());
        }

        public int size() {
            int size = 0;
            for(List<Comment> c: this.leading.values()) { size += c.size(); }
            for(List<Comment> c: this.trailing.values()) { size += c.size(); }
            for(List<Comment> c: this.dangling.values()) { size += c.size(); }
            return size;
        }

        private static void add(
            Map<AstNode, List<Comment>> map, AstNode node, Comment comment
        ) {
            map.computeIfAbsent(node, n -> new ArrayList<>()).add(comment);
        }

    }

    private CommentAttacher() {}

    /** The statements held directly by the given node, if it holds any. */
    public static List<AstNode> childrenOf(AstNode container) {
        switch(container.type) {
            case PROGRAM:
                return container.<AstNode.Program>getValue().body();
            case BLOCK:
                return container.<AstNode.Block>getValue().body();
            case GENUS:
                return container.<AstNode.Genus>getValue().members();
            case PACTUM:
                return container.<AstNode.Pactum>getValue().methods();
            case PROBANDUM:
                return container.<AstNode.Probandum>getValue().body();
            default:
                return null;
        }
    }

    public static Attached attach(
        AstNode program, List<Comment> comments, String text
    ) {
        List<AstNode> containers = new ArrayList<>();
        program.transform(node -> {
            if(CommentAttacher.childrenOf(node) != null) {
                containers.add(node);
            }
            return node;
        });
        Attached attached = new Attached();
        for(Comment comment: comments) {
            AstNode container = CommentAttacher.innermost(
                containers, comment
            );
            if(container == null) {
                container = program;
            }
            CommentAttacher.place(attached, container, comment, text);
        }
        LOGGER.log(Level.FINE, "Attached {0} comments", comments.size());
        return attached;
    }

    private static AstNode innermost(
        List<AstNode> containers, Comment comment
    ) {
        AstNode best = null;
        for(AstNode container: containers) {
            if(!container.source.contains(comment.start())) { continue; }
            int span = container.source.endOffset()
                - container.source.startOffset();
            if(best == null || span < best.source.endOffset()
                    - best.source.startOffset()) {
                best = container;
            }
        }
        return best;
    }

    private static void place(
        Attached attached, AstNode container, Comment comment, String text
    ) {
        AstNode previous = null;
        AstNode next = null;
        for(AstNode child: CommentAttacher.childrenOf(container)) {
            if(child.source.contains(comment.start())) {
                Attached.add(attached.leading, child, comment);
                return;
            }
            if(child.source.endOffset() <= comment.start()) {
                previous = child;
            } else if(next == null && child.source.startOffset() >= comment.end()) {
                next = child;
            }
        }
        boolean sameLine = previous != null && text.substring(
            previous.source.endOffset(), comment.start()
        ).indexOf('\n') == -1;
        if(sameLine) {
            Attached.add(attached.trailing, previous, comment);
        } else if(next != null) {
            Attached.add(attached.leading, next, comment);
        } else {
            Attached.add(attached.dangling, container, comment);
        }
    }

}
