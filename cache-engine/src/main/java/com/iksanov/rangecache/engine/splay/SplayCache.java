package com.iksanov.rangecache.engine.splay;

import com.iksanov.rangecache.engine.metrics.SplayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Self-adjusting binary search tree keyed on {@code long}, used as a memoization cache.
 * <p>
 * Every {@link #search} and {@link #insert} splays the tree toward the requested key:
 * the matching node, or the last node on the search path when the key is absent,
 * becomes the new root. Rotations follow the bottom-up zig-zig / zig-zag scheme.
 * <p>
 * Each node exclusively owns its two children and there are no parent pointers.
 * The splay walks down with an explicit stack instead of recursing, so degenerate
 * (list-shaped) trees cannot overflow the call stack. Not thread-safe.
 *
 * @param <V> value type
 */
public class SplayCache<V> {

    private static final Logger log = LoggerFactory.getLogger(SplayCache.class);

    private static final class Node<V> {
        final long key;
        V value;
        Node<V> left, right;

        Node(long key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private enum Step { ZIG_ZIG, ZIG_ZAG }

    private record Frame<T>(Node<T> node, boolean leftSide, Step step) {}

    private final SplayMetrics metrics;
    private Node<V> root;
    private int size;
    private int rotations;

    public SplayCache() {
        this(new SplayMetrics());
    }

    public SplayCache(SplayMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Looks up {@code key}. The root is replaced by the splay result whether or not
     * the key is present.
     */
    public Optional<V> search(long key) {
        root = splay(root, key);
        if (root != null && root.key == key) {
            metrics.recordHit();
            return Optional.of(root.value);
        }
        metrics.recordMiss();
        return Optional.empty();
    }

    /**
     * Inserts or overwrites {@code key}. Afterwards the node holding {@code key} is the root.
     */
    public void insert(long key, V value) {
        Objects.requireNonNull(value, "value");
        if (root == null) {
            root = new Node<>(key, value);
            grow();
            return;
        }

        root = splay(root, key);
        if (root.key == key) {
            root.value = value;
            return;
        }

        Node<V> node = new Node<>(key, value);
        if (key < root.key) {
            node.left = root.left;
            node.right = root;
            root.left = null;
        } else {
            node.right = root.right;
            node.left = root;
            root.right = null;
        }
        root = node;
        grow();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        root = null;
        size = 0;
        metrics.updateSize(0);
        log.debug("Splay cache cleared");
    }

    public OptionalLong rootKey() {
        return root == null ? OptionalLong.empty() : OptionalLong.of(root.key);
    }

    /**
     * In-order key listing. Does not splay.
     */
    public List<Long> keysInOrder() {
        List<Long> keys = new ArrayList<>(size);
        Deque<Node<V>> pending = new ArrayDeque<>();
        Node<V> current = root;
        while (current != null || !pending.isEmpty()) {
            while (current != null) {
                pending.push(current);
                current = current.left;
            }
            current = pending.pop();
            keys.add(current.key);
            current = current.right;
        }
        return keys;
    }

    /**
     * Preorder key listing with {@code null} for every absent child, which pins down the exact tree shape.
     * Does not splay.
     */
    List<Long> preorderShape() {
        List<Long> shape = new ArrayList<>();
        Deque<Optional<Node<V>>> pending = new ArrayDeque<>();
        pending.push(Optional.ofNullable(root));
        while (!pending.isEmpty()) {
            Optional<Node<V>> next = pending.pop();
            if (next.isEmpty()) {
                shape.add(null);
                continue;
            }
            Node<V> node = next.get();
            shape.add(node.key);
            pending.push(Optional.ofNullable(node.right));
            pending.push(Optional.ofNullable(node.left));
        }
        return shape;
    }

    /**
     * Height of the tree, 0 when empty. Does not splay.
     */
    public int height() {
        if (root == null) return 0;
        int height = 0;
        Deque<Node<V>> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                Node<V> node = level.poll();
                if (node.left != null) level.add(node.left);
                if (node.right != null) level.add(node.right);
            }
        }
        return height;
    }

    private void grow() {
        size++;
        metrics.recordInsert();
        metrics.updateSize(size);
    }

    /**
     * Splays the subtree rooted at {@code subtree} toward {@code key} and returns the new subtree root.
     * <p>
     * The descent records one frame per zig-zig or zig-zag step, jumping two levels at a time.
     * Unwinding then replays the rotations innermost first, exactly as the recursive
     * formulation would on return.
     */
    private Node<V> splay(Node<V> subtree, long key) {
        rotations = 0;
        Deque<Frame<V>> frames = new ArrayDeque<>();
        Node<V> current = subtree;
        Node<V> result;

        while (true) {
            if (current == null || current.key == key) {
                result = current;
                break;
            }
            if (key < current.key) {
                Node<V> child = current.left;
                if (child == null) {
                    result = current;
                    break;
                }
                if (key < child.key) {
                    frames.push(new Frame<>(current, true, Step.ZIG_ZIG));
                    current = child.left;
                } else if (key > child.key) {
                    frames.push(new Frame<>(current, true, Step.ZIG_ZAG));
                    current = child.right;
                } else {
                    result = rotateRight(current);
                    break;
                }
            } else {
                Node<V> child = current.right;
                if (child == null) {
                    result = current;
                    break;
                }
                if (key > child.key) {
                    frames.push(new Frame<>(current, false, Step.ZIG_ZIG));
                    current = child.right;
                } else if (key < child.key) {
                    frames.push(new Frame<>(current, false, Step.ZIG_ZAG));
                    current = child.left;
                } else {
                    result = rotateLeft(current);
                    break;
                }
            }
        }

        while (!frames.isEmpty()) {
            Frame<V> frame = frames.pop();
            result = frame.leftSide()
                    ? unwindLeft(frame.node(), frame.step(), result)
                    : unwindRight(frame.node(), frame.step(), result);
        }
        metrics.recordRotations(rotations);
        return result;
    }

    // Key lies in the left subtree of node; splayed is the already-splayed grandchild subtree.
    private Node<V> unwindLeft(Node<V> node, Step step, Node<V> splayed) {
        if (step == Step.ZIG_ZIG) {
            node.left.left = splayed;
            node = rotateRight(node);
        } else {
            node.left.right = splayed;
            if (node.left.right != null) node.left = rotateLeft(node.left);
        }
        return node.left == null ? node : rotateRight(node);
    }

    private Node<V> unwindRight(Node<V> node, Step step, Node<V> splayed) {
        if (step == Step.ZIG_ZIG) {
            node.right.right = splayed;
            node = rotateLeft(node);
        } else {
            node.right.left = splayed;
            if (node.right.left != null) node.right = rotateRight(node.right);
        }
        return node.right == null ? node : rotateLeft(node);
    }

    private Node<V> rotateRight(Node<V> x) {
        Node<V> y = x.left;
        x.left = y.right;
        y.right = x;
        rotations++;
        return y;
    }

    private Node<V> rotateLeft(Node<V> x) {
        Node<V> y = x.right;
        x.right = y.left;
        y.left = x;
        rotations++;
        return y;
    }
}
