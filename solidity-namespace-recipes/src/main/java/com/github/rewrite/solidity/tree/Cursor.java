package com.github.rewrite.solidity.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A forward-only, pre-order traversal handle over an immutable syntax tree.
 * <p>
 * A cursor never walks outside the subtree it was created for. {@link #spawn()} starts a
 * new cursor limited to the current node, and {@link #copy()} clones the current position;
 * both return handles that advance independently of this one.
 */
public class Cursor {

    private static final class Frame {
        final NonterminalNode parent;
        int childIndex;

        Frame(NonterminalNode parent, int childIndex) {
            this.parent = parent;
            this.childIndex = childIndex;
        }
    }

    private final List<Frame> path;
    private Node current;
    private int currentOffset;
    private boolean completed;

    public Cursor(Node root) {
        this(root, 0);
    }

    Cursor(Node root, int rootOffset) {
        this.path = new ArrayList<>();
        this.current = root;
        this.currentOffset = rootOffset;
    }

    private Cursor(Cursor other) {
        this.path = new ArrayList<>(other.path.size());
        for (Frame frame : other.path) {
            this.path.add(new Frame(frame.parent, frame.childIndex));
        }
        this.current = other.current;
        this.currentOffset = other.currentOffset;
        this.completed = other.completed;
    }

    public Node node() {
        return current;
    }

    /**
     * @return the range of the current node, in offsets of the text the whole tree was
     * parsed from
     */
    public TextRange textRange() {
        return new TextRange(currentOffset, currentOffset + current.getTextLength());
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * @return the number of ancestors between the current node and this cursor's root
     */
    public int depth() {
        return path.size();
    }

    /**
     * @return a new cursor whose root is the current node
     */
    public Cursor spawn() {
        return new Cursor(current, currentOffset);
    }

    /**
     * @return a new cursor at the same position, sharing this cursor's root
     */
    public Cursor copy() {
        return new Cursor(this);
    }

    /**
     * Moves to the next node in pre-order.
     *
     * @return {@code false} once the subtree is exhausted; the cursor is then completed
     */
    public boolean goToNext() {
        if (completed) {
            return false;
        }
        if (!current.isTerminal()) {
            NonterminalNode nonterminal = (NonterminalNode) current;
            if (!nonterminal.getChildren().isEmpty()) {
                path.add(new Frame(nonterminal, 0));
                current = nonterminal.getChildren().get(0);
                return true;
            }
        }
        int offset = currentOffset + current.getTextLength();
        while (!path.isEmpty()) {
            Frame top = path.get(path.size() - 1);
            if (top.childIndex + 1 < top.parent.getChildren().size()) {
                top.childIndex++;
                current = top.parent.getChildren().get(top.childIndex);
                currentOffset = offset;
                return true;
            }
            path.remove(path.size() - 1);
        }
        completed = true;
        return false;
    }

    public boolean goToNextNonterminalWithKind(NonterminalKind kind) {
        while (goToNext()) {
            if (!current.isTerminal() && ((NonterminalNode) current).is(kind)) {
                return true;
            }
        }
        return false;
    }

    public boolean goToNextTerminal() {
        while (goToNext()) {
            if (current.isTerminal()) {
                return true;
            }
        }
        return false;
    }

    public boolean goToNextTerminalWithKind(TerminalKind kind) {
        while (goToNext()) {
            if (current.isTerminal() && ((TerminalNode) current).is(kind)) {
                return true;
            }
        }
        return false;
    }
}
