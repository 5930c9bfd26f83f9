package com.wordgrid.domain;

import java.util.HashMap;
import java.util.Map;

/**
 * Dictionary stored as a prefix tree over single characters.
 *
 * <p>Search code descends one character at a time with {@link #childFor(Node, char)} and keeps the
 * returned node, so extending a path by one letter never re-walks the prefix from the root. The
 * index performs no filtering or normalization: callers insert words already trimmed, bounded in
 * length and upper-cased.
 *
 * <p>Not thread-safe while being built. Once fully built it is only read, and may then be shared.
 */
public final class PrefixIndex {
  private final Node root = new Node();
  private int size;

  /** One prefix position. The root stands for the empty prefix. */
  public static final class Node {
    private final Map<Character, Node> children = new HashMap<>();
    private boolean terminal;

    private Node() {}
  }

  public Node root() {
    return root;
  }

  /**
   * Insert a word, creating missing nodes along its path and marking the last one terminal.
   * Inserting a word a second time changes nothing.
   *
   * @param word non-empty word
   */
  public void insert(String word) {
    Node node = root;
    for (int i = 0; i < word.length(); i++) {
      node = node.children.computeIfAbsent(word.charAt(i), k -> new Node());
    }
    if (!node.terminal) {
      node.terminal = true;
      size++;
    }
  }

  /**
   * Step from {@code node} along {@code ch}.
   *
   * @return the child node, or {@code null} if no indexed word continues this way
   */
  public Node childFor(Node node, char ch) {
    return node.children.get(ch);
  }

  public boolean isTerminal(Node node) {
    return node.terminal;
  }

  /** @return true if {@code word} was inserted */
  public boolean contains(String word) {
    Node node = find(word);
    return node != null && node.terminal;
  }

  /** @return true if some inserted word starts with {@code prefix} */
  public boolean hasPrefix(String prefix) {
    return find(prefix) != null;
  }

  /** Number of distinct words inserted. */
  public int size() {
    return size;
  }

  private Node find(String s) {
    Node node = root;
    for (int i = 0; i < s.length() && node != null; i++) {
      node = node.children.get(s.charAt(i));
    }
    return node;
  }
}
