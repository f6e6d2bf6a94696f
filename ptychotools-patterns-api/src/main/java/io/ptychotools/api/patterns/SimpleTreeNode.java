package io.ptychotools.api.patterns;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// A tree of string rows describing the contents of a data file, such as the groups and datasets
/// of a container format. The root row holds column headers.
public final class SimpleTreeNode {

  private final SimpleTreeNode parent;
  private final List<String> row;
  private final List<SimpleTreeNode> children = new ArrayList<>();

  private SimpleTreeNode(SimpleTreeNode parent, List<String> row) {
    this.parent = parent;
    this.row = List.copyOf(row);
  }

  /// @param headers column headers
  /// @return a new root node
  public static SimpleTreeNode createRoot(List<String> headers) {
    return new SimpleTreeNode(null, headers);
  }

  /// Append a child row
  /// @param row the child's column values
  /// @return the new child
  public SimpleTreeNode createChild(List<String> row) {
    SimpleTreeNode child = new SimpleTreeNode(this, row);
    children.add(child);
    return child;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public SimpleTreeNode getParent() {
    return parent;
  }

  public List<String> getRow() {
    return row;
  }

  public List<SimpleTreeNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /// @return the number of nodes below this one
  public int countDescendants() {
    int count = 0;
    for (SimpleTreeNode child : children) {
      count += 1 + child.countDescendants();
    }
    return count;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, 0);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb, int depth) {
    sb.append("  ".repeat(depth)).append(String.join(" | ", row)).append('\n');
    for (SimpleTreeNode child : children) {
      child.appendTo(sb, depth + 1);
    }
  }
}
