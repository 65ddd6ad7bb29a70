package se.kth.codetree.util;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * A pre-order iterator over a tree or a forest. The iterator uses an explicit stack, so arbitrarily deep trees can
 * be walked without recursion.
 *
 * @param <T> Type of the tree nodes.
 */
public class DepthFirstIterator<T> implements Iterator<T> {
    private final Deque<T> stack = new ArrayDeque<>();
    private final Function<T, List<T>> getChildren;

    private DepthFirstIterator(List<T> roots, Function<T, List<T>> getChildren) {
        this.getChildren = getChildren;
        pushAll(roots);
    }

    /**
     * @param root The first node to visit.
     * @param getChildren A function returning the ordered children of a node.
     * @return An iterator over the tree rooted in root.
     */
    public static <T> DepthFirstIterator<T> of(T root, Function<T, List<T>> getChildren) {
        return new DepthFirstIterator<>(Collections.singletonList(root), getChildren);
    }

    /**
     * @param roots The roots of a forest, visited in order.
     * @param getChildren A function returning the ordered children of a node.
     * @return An iterator over all trees of the forest.
     */
    public static <T> DepthFirstIterator<T> ofForest(List<T> roots, Function<T, List<T>> getChildren) {
        return new DepthFirstIterator<>(roots, getChildren);
    }

    @Override
    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @Override
    public T next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        T node = stack.pop();
        pushAll(getChildren.apply(node));
        return node;
    }

    private void pushAll(List<T> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(nodes.get(i));
        }
    }
}
