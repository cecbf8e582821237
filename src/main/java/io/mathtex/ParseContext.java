/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.mathtex;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state for a single parse: the stack of scope frames that decides where
 * new nodes are attached, and the stack of open environments.
 * <p>
 * The scope stack is never empty. Its bottom frame is always the current line of
 * the document environment and each open environment has its own line frame
 * somewhere above that. Frames only hold references into the tree for routing;
 * the tree itself owns the nodes.
 * </p>
 */
class ParseContext {

  static final int NO_ARITY = -1;

  static class Frame {
    Node      node;         // Node that new children are added to
    final int arity;        // Number of children after which frame closes or NO_ARITY

    Frame(Node node, int arity) {
      this.node  = node;
      this.arity = arity;
    }

    boolean isComplete() {
      return arity != NO_ARITY && node.children.size() == arity;
    }
  }

  static class OpenEnvironment {
    final Node.Environment environment;
    final int              depth;         // Scope depth of environment's line frame

    OpenEnvironment(Node.Environment environment, int depth) {
      this.environment = environment;
      this.depth       = depth;
    }
  }

  private final Deque<Frame>           scopes       = new ArrayDeque<>();
  private final Deque<OpenEnvironment> environments = new ArrayDeque<>();

  ParseContext(Node.Document document) {
    pushEnvironment(document.getEnvironment());
  }

  Frame top() {
    return scopes.peek();
  }

  int depth() {
    return scopes.size();
  }

  void pushScope(Node node, int arity) {
    scopes.push(new Frame(node, arity));
  }

  void pushScope(Node node) {
    pushScope(node, NO_ARITY);
  }

  Frame popScope() {
    if (scopes.size() <= environment().depth) {
      throw new IllegalStateException("Internal error: attempt to pop line frame of environment '" + environment().environment.getName() + "'");
    }
    return scopes.pop();
  }

  void addChild(Node node) {
    top().node.addChild(node);
  }

  /**
   * Pop frames whose arity has been reached. Popping a frame can complete the frame
   * below it so we keep going until the top frame still needs more children.
   */
  void popCompletedScopes() {
    while (top().isComplete()) {
      scopes.pop();
    }
  }

  /**
   * @return number of frames above the innermost environment's line frame
   */
  int openScopeCount() {
    return scopes.size() - environment().depth;
  }

  /**
   * Discard any frames above the innermost environment's line frame.
   */
  void resetToEnvironment() {
    while (openScopeCount() > 0) {
      scopes.pop();
    }
  }

  /**
   * Point the innermost environment's line frame at a different line.
   */
  void replaceLine(Node.Line line) {
    if (openScopeCount() != 0) {
      throw new IllegalStateException("Internal error: scopes still open when replacing line");
    }
    top().node = line;
  }

  void pushEnvironment(Node.Environment environment) {
    pushScope(environment.currentParagraph().currentLine());
    environments.push(new OpenEnvironment(environment, scopes.size()));
  }

  Node.Environment popEnvironment() {
    if (openScopeCount() != 0) {
      throw new IllegalStateException("Internal error: scopes still open when closing environment");
    }
    OpenEnvironment open = environments.pop();
    scopes.pop();
    return open.environment;
  }

  OpenEnvironment environment() {
    return environments.peek();
  }

  int environmentCount() {
    return environments.size();
  }
}
