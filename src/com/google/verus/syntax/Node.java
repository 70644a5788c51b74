/*
 * Copyright 2026 The Verus Syntax Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.verus.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node. A node has a kind and an ordered list of children, each of which
 * is either a {@link Token} or another node and may carry a {@link Tag} naming its role. Comment
 * tokens are kept as children so that the tree covers every non-whitespace character it spans.
 *
 * <p>The range of a node is computed from its first and last child; a node with no children
 * covers the empty range at the position it was started at.
 */
public final class Node implements SyntaxElement {

  private final NodeKind kind;
  private final ImmutableList<SyntaxElement> children;
  // Parallel to children; null where a child has no role.
  private final @Nullable Tag[] tags;
  private final int start;
  private final int end;

  private Node(NodeKind kind, List<SyntaxElement> children, List<@Nullable Tag> tags, int at) {
    this.kind = kind;
    this.children = ImmutableList.copyOf(children);
    this.tags = tags.toArray(new Tag[0]);
    if (children.isEmpty()) {
      this.start = at;
      this.end = at;
    } else {
      this.start = children.get(0).start();
      this.end = children.get(children.size() - 1).end();
    }
  }

  public static Builder builder(NodeKind kind, int at) {
    return new Builder(kind, at);
  }

  public NodeKind getKind() {
    return kind;
  }

  public boolean isKind(NodeKind kind) {
    return this.kind == kind;
  }

  @Override
  public int start() {
    return start;
  }

  @Override
  public int end() {
    return end;
  }

  public ImmutableList<SyntaxElement> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public SyntaxElement getChild(int index) {
    return children.get(index);
  }

  public @Nullable Tag getTag(int index) {
    return tags[index];
  }

  /** Returns the first child with the given role, or null. */
  public @Nullable SyntaxElement getFirstChild(Tag tag) {
    for (int i = 0; i < tags.length; i++) {
      if (tags[i] == tag) {
        return children.get(i);
      }
    }
    return null;
  }

  /** Returns the first child with the given role if it is a node, otherwise null. */
  public @Nullable Node getFirstNode(Tag tag) {
    SyntaxElement child = getFirstChild(tag);
    return child instanceof Node ? (Node) child : null;
  }

  public @Nullable Token getFirstToken(Tag tag) {
    SyntaxElement child = getFirstChild(tag);
    return child instanceof Token ? (Token) child : null;
  }

  public ImmutableList<SyntaxElement> getChildren(Tag tag) {
    ImmutableList.Builder<SyntaxElement> result = ImmutableList.builder();
    for (int i = 0; i < tags.length; i++) {
      if (tags[i] == tag) {
        result.add(children.get(i));
      }
    }
    return result.build();
  }

  /** Returns the child nodes with the given role. */
  public ImmutableList<Node> getNodes(Tag tag) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (int i = 0; i < tags.length; i++) {
      if (tags[i] == tag && children.get(i) instanceof Node) {
        result.add((Node) children.get(i));
      }
    }
    return result.build();
  }

  /** Returns the direct child nodes of the given kind. */
  public ImmutableList<Node> getNodes(NodeKind childKind) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (SyntaxElement child : children) {
      if (child instanceof Node && ((Node) child).kind == childKind) {
        result.add((Node) child);
      }
    }
    return result.build();
  }

  public @Nullable Node getFirstNode(NodeKind childKind) {
    for (SyntaxElement child : children) {
      if (child instanceof Node && ((Node) child).kind == childKind) {
        return (Node) child;
      }
    }
    return null;
  }

  /** Returns the child nodes, skipping tokens. */
  public ImmutableList<Node> getChildNodes() {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (SyntaxElement child : children) {
      if (child instanceof Node) {
        result.add((Node) child);
      }
    }
    return result.build();
  }

  /** Whether this node has a direct token child that is the given keyword or punctuation. */
  public boolean hasToken(String text) {
    for (SyntaxElement child : children) {
      if (child instanceof Token
          && !((Token) child).isComment()
          && ((Token) child).text().equals(text)) {
        return true;
      }
    }
    return false;
  }

  /** Returns every token in this subtree, comments included, in source order. */
  public ImmutableList<Token> getAllTokens() {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    collectTokens(result);
    return result.build();
  }

  private void collectTokens(ImmutableList.Builder<Token> result) {
    for (SyntaxElement child : children) {
      if (child instanceof Token) {
        result.add((Token) child);
      } else {
        ((Node) child).collectTokens(result);
      }
    }
  }

  /** Returns the first token of this subtree that is not a comment, or null. */
  public @Nullable Token getFirstSignificantToken() {
    for (SyntaxElement child : children) {
      if (child instanceof Token) {
        if (!((Token) child).isComment()) {
          return (Token) child;
        }
      } else {
        Token token = ((Node) child).getFirstSignificantToken();
        if (token != null) {
          return token;
        }
      }
    }
    return null;
  }

  /** Returns a builder holding this node's kind and children, for rewriting. */
  public Builder toBuilder() {
    Builder builder = new Builder(kind, start);
    for (int i = 0; i < children.size(); i++) {
      builder.add(tags[i], children.get(i));
    }
    return builder;
  }

  /**
   * Whether the two trees have the same shape: the same kinds, tags and token kinds and texts.
   * Positions are ignored.
   */
  public boolean isEquivalentTo(Node other) {
    if (kind != other.kind || children.size() != other.children.size()) {
      return false;
    }
    if (!Arrays.equals(tags, other.tags)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      SyntaxElement mine = children.get(i);
      SyntaxElement theirs = other.children.get(i);
      if (mine instanceof Node) {
        if (!(theirs instanceof Node) || !((Node) mine).isEquivalentTo((Node) theirs)) {
          return false;
        }
      } else {
        if (!(theirs instanceof Token)) {
          return false;
        }
        Token a = (Token) mine;
        Token b = (Token) theirs;
        if (a.kind() != b.kind() || !a.text().equals(b.text())) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return kind + " [" + start + "," + end + ")";
  }

  /** Returns an indented dump of the subtree, one element per line. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0, null);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level, @Nullable Tag tag) {
    indent(sb, level);
    sb.append(kind).append(" [").append(start).append(',').append(end).append(')');
    if (tag != null) {
      sb.append(" (").append(tag).append(')');
    }
    sb.append('\n');
    for (int i = 0; i < children.size(); i++) {
      SyntaxElement child = children.get(i);
      if (child instanceof Node) {
        ((Node) child).appendStringTree(sb, level + 1, tags[i]);
      } else {
        Token token = (Token) child;
        indent(sb, level + 1);
        sb.append(token.kind()).append(" '").append(token.text()).append('\'');
        if (tags[i] != null) {
          sb.append(" (").append(tags[i]).append(')');
        }
        sb.append('\n');
      }
    }
  }

  private static void indent(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
  }

  /**
   * Accumulates the children of a node under construction. A builder is owned by a single
   * grammar rule; abandoning it discards everything it collected.
   */
  public static final class Builder {
    private NodeKind kind;
    private final int at;
    private final List<SyntaxElement> children = new ArrayList<>();
    private final List<@Nullable Tag> tags = new ArrayList<>();

    private Builder(NodeKind kind, int at) {
      this.kind = checkNotNull(kind);
      this.at = at;
    }

    @CanIgnoreReturnValue
    public Builder add(SyntaxElement child) {
      return add(null, child);
    }

    @CanIgnoreReturnValue
    public Builder add(@Nullable Tag tag, SyntaxElement child) {
      checkNotNull(child);
      if (!children.isEmpty()) {
        SyntaxElement last = children.get(children.size() - 1);
        checkArgument(
            child.start() >= last.end(), "%s added out of order after %s", child, last);
      }
      children.add(child);
      tags.add(tag);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(List<? extends SyntaxElement> elements) {
      for (SyntaxElement element : elements) {
        add(element);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setKind(NodeKind kind) {
      this.kind = checkNotNull(kind);
      return this;
    }

    public NodeKind getKind() {
      return kind;
    }

    /** The number of children collected so far. */
    public int size() {
      return children.size();
    }

    public boolean isEmpty() {
      return children.isEmpty();
    }

    /** Drops every child added after the builder held {@code size} children. */
    public void truncate(int size) {
      while (children.size() > size) {
        children.remove(children.size() - 1);
        tags.remove(tags.size() - 1);
      }
    }

    public Node build() {
      return new Node(kind, children, tags, at);
    }
  }
}
