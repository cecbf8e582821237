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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.stream.Collectors;

import static io.mathtex.LexemeKind.*;
import static io.mathtex.ParseError.Type.*;

/**
 * Structural assembler that turns the stream of lexemes from the {@link Tokeniser}
 * into a tree of {@link Node}s.
 * <p>
 * Rather than recursive descent this is a stack machine. The {@link ParseContext}
 * holds a stack of scope frames and each lexeme is dispatched on its kind: most
 * lexemes just become a {@link Node.Plain} added to the node of the top frame while
 * opening delimiters, commands with arguments, scripts and environments push a new
 * frame. Closing delimiters and <code>\end</code> pop frames explicitly.
 * </p><p>
 * Commands with a fixed number of arguments (<code>\sqrt</code>, <code>\dfrac</code>,
 * <code>\sin</code>, ...) and the '_' and '^' markers push a frame with an arity.
 * After every lexeme any frame whose node has reached its arity is popped, which
 * also closes the enclosing frames when they are completed in turn. This means that
 * in <code>x^\dfrac{1}{2}</code> the '^' closes as soon as the second argument of
 * <code>\dfrac</code> is finished.
 * </p>
 * The first structural error aborts the parse with a {@link ParseError}.
 */
public class Parser {

  private static final Logger log = LogManager.getLogger(Parser.class);

  private final Tokeniser      tokeniser;
  private final MathTexContext context;

  public Parser(Tokeniser tokeniser, MathTexContext context) {
    this.tokeniser = tokeniser;
    this.context   = context;
  }

  /**
   * Parse the entire source.
   * @return the Document node for the source
   * @throws ParseError if source is not well-formed
   */
  public Node.Document parse() {
    Node.Document document = new Node.Document();
    ParseContext  state    = new ParseContext(document);
    while (tokeniser.hasNext()) {
      Lexeme lexeme = tokeniser.next();
      if (log.isDebugEnabled()) {
        log.debug("depth {}: {}", state.depth(), lexeme);
      }
      dispatch(lexeme, state);
      state.popCompletedScopes();
    }
    endOfInput(state);
    return document;
  }

  private void dispatch(Lexeme lexeme, ParseContext state) {
    switch (lexeme.getKind()) {
      case SUBSCRIPT:
      case SUPERSCRIPT:     attachScript(lexeme, state);      break;
      case BEGIN:           beginEnvironment(lexeme, state);  break;
      case END:             endEnvironment(lexeme, state);    break;
      case LEFT_PAREN:      openGroup(new Node.ParenGroup(lexeme), state);    break;
      case LEFT_SQUARE:     openGroup(new Node.BracketGroup(lexeme), state);  break;
      case LEFT_BRACE:      openGroup(new Node.BraceGroup(lexeme), state);    break;
      case RIGHT_PAREN:
      case RIGHT_SQUARE:
      case RIGHT_BRACE:     closeGroup(lexeme, state);        break;
      case LINE_BREAK:      lineBreak(lexeme, state);         break;
      case PARAGRAPH_BREAK: paragraphBreak(lexeme, state);    break;
      case UNKNOWN:         unknown(lexeme, state);           break;
      default: {
        Node.Plain node = new Node.Plain(lexeme);
        state.addChild(node);
        int arity = lexeme.getKind().arity();
        if (arity > 0) {
          state.pushScope(node, arity);
        }
        break;
      }
    }
  }

  /**
   * '_' and '^' attach to the node immediately before them in the current scope and
   * then take the next node as their one argument.
   */
  private void attachScript(Lexeme lexeme, ParseContext state) {
    boolean isSubscript = lexeme.is(SUBSCRIPT);
    String  what        = isSubscript ? "Subscript" : "Superscript";
    Node    previous    = state.top().node.lastChild();
    if (previous == null || !previous.canAttach()) {
      throw error(DANGLING_ATTACHMENT, what + " without previous node", lexeme);
    }
    Node.Scriptable target = (Node.Scriptable)previous;
    Node.Plain      marker = new Node.Plain(lexeme);
    if (isSubscript) {
      if (target.subscript != null) {
        throw error(DUPLICATE_ATTACHMENT, "Double subscript", lexeme);
      }
      target.subscript = marker;
    }
    else {
      if (target.superscript != null) {
        throw error(DUPLICATE_ATTACHMENT, "Double superscript", lexeme);
      }
      target.superscript = marker;
    }
    state.pushScope(marker, lexeme.getKind().arity());
  }

  private void openGroup(Node.Group group, ParseContext state) {
    state.addChild(group);
    state.pushScope(group);
  }

  private void closeGroup(Lexeme lexeme, ParseContext state) {
    Node top = state.top().node;
    if (state.openScopeCount() == 0) {
      throw error(DELIMITER_MISMATCH, "Unexpected '" + lexeme.getText() + "' with no matching opening delimiter", lexeme);
    }
    if (!(top instanceof Node.Group)) {
      throw error(DELIMITER_MISMATCH, "Unexpected '" + lexeme.getText() + "' while expecting argument for '" +
                                      top.getLexeme().getText() + "'", lexeme);
    }
    Node.Group group = (Node.Group)top;
    if (lexeme.isNot(group.closingKind())) {
      throw error(DELIMITER_MISMATCH, "Mismatched '" + lexeme.getText() + "': expecting '" + group.closingKind() +
                                      "' to close '" + group.getLexeme().getText() + "' @ line " +
                                      group.getLexeme().getLineNum() + ", column " + group.getLexeme().getColumn(), lexeme);
    }
    state.popScope();
  }

  private void beginEnvironment(Lexeme lexeme, ParseContext state) {
    String name = environmentName(lexeme);
    Node.Environment environment = new Node.Environment(name, lexeme);
    state.addChild(environment);
    state.pushEnvironment(environment);
  }

  private void endEnvironment(Lexeme lexeme, ParseContext state) {
    String name = environmentName(lexeme);
    ParseContext.OpenEnvironment open = state.environment();
    if (state.environmentCount() == 1) {
      throw error(ENVIRONMENT_MISMATCH, "Unexpected \\end{" + name + "} with no matching \\begin{" + name + "}", lexeme);
    }
    if (!open.environment.getName().equals(name)) {
      throw error(ENVIRONMENT_MISMATCH, "Mismatched environment: \\end{" + name + "} does not match \\begin{" +
                                        open.environment.getName() + "} @ line " + open.environment.getLexeme().getLineNum() +
                                        ", column " + open.environment.getLexeme().getColumn(), lexeme);
    }
    closeOpenScopes(lexeme, state);
    state.popEnvironment();
  }

  /**
   * Read the "{name}" that must immediately follow \begin and \end.
   */
  private String environmentName(Lexeme command) {
    expect(command, LEFT_BRACE);
    Lexeme name = expect(command, ALPHABET);
    expect(command, RIGHT_BRACE);
    return name.getText();
  }

  private void lineBreak(Lexeme lexeme, ParseContext state) {
    closeOpenScopes(lexeme, state);
    Node.Environment environment = state.environment().environment;
    state.replaceLine(environment.currentParagraph().newLine());
  }

  private void paragraphBreak(Lexeme lexeme, ParseContext state) {
    closeOpenScopes(lexeme, state);
    Node.Environment environment = state.environment().environment;
    state.replaceLine(environment.newParagraph().currentLine());
  }

  private void unknown(Lexeme lexeme, ParseContext state) {
    if (context.failOnUnknownCommand() && lexeme.isCommand()) {
      throw error(UNKNOWN_COMMAND, "Unknown command '" + lexeme.getText() + "'", lexeme);
    }
    state.addChild(new Node.Plain(lexeme));
  }

  /**
   * Before leaving the current line or environment make sure nothing is still open.
   * In lenient mode the open frames are just abandoned.
   */
  private void closeOpenScopes(Lexeme lexeme, ParseContext state) {
    if (state.openScopeCount() > 0) {
      if (!context.allowUnclosed()) {
        throw unclosed(state.top().node, "before '" + lexeme.getText().replace("\n", "\\n").replace("\r", "\\r") + "'", lexeme);
      }
      log.debug("Abandoning {} open scope(s) at {}", state.openScopeCount(), lexeme);
      state.resetToEnvironment();
    }
  }

  private void endOfInput(ParseContext state) {
    if (context.allowUnclosed()) {
      return;
    }
    Location end = tokeniser.endOfInput();
    if (state.openScopeCount() > 0) {
      throw unclosed(state.top().node, "at end of input", end);
    }
    if (state.environmentCount() > 1) {
      throw unclosed(state.environment().environment, "at end of input", end);
    }
  }

  private ParseError unclosed(Node node, String where, Location location) {
    Lexeme open = node.getLexeme();
    String what = node instanceof Node.Environment ? "\\begin{" + ((Node.Environment)node).getName() + "}"
                                                   : "'" + open.getText() + "'";
    String kind = node instanceof Node.Group ? "Unclosed "
                                             : node instanceof Node.Environment ? "Unclosed environment "
                                                                                : "Missing argument for ";
    return error(UNCLOSED_SCOPE, kind + what + " " + where + " (opened @ line " + open.getLineNum() +
                                 ", column " + open.getColumn() + ")", location);
  }

  /**
   * Expect the next lexeme to be one of the given kinds and return it or throw error if no match.
   */
  private Lexeme expect(Lexeme command, LexemeKind... kinds) {
    String expected = Arrays.stream(kinds)
                            .map(kind -> kind.is(ALPHABET) ? "environment name" : "'" + kind + "'")
                            .collect(Collectors.joining(" or "));
    if (!tokeniser.hasNext()) {
      throw error(MALFORMED_ENVIRONMENT, "Unexpected end of input after " + command.getText() + ": expecting " + expected,
                  tokeniser.endOfInput());
    }
    Lexeme lexeme = tokeniser.next();
    if (lexeme.isNot(kinds)) {
      throw error(MALFORMED_ENVIRONMENT, "Unexpected '" + lexeme.getText() + "' after " + command.getText() +
                                         ": expecting " + expected, lexeme);
    }
    return lexeme;
  }

  private ParseError error(ParseError.Type type, String msg, Location location) {
    return new ParseError(type, msg, location);
  }
}
