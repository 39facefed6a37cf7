package io.genxdata.engine.mask;

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

import io.genxdata.engine.errors.InvalidConfigParamException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses row filter expressions such as {@code age > 30 and status in ['A', 'B']}
 * into a {@link MaskNode} tree.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * or      := and (('or' | '|') and)*
 * and     := not (('and' | '&amp;') not)*
 * not     := ('not' | '~') not | primary
 * primary := '(' or ')' | operand [op operand | ['not'] 'in' list]
 * </pre>
 * A bare column operand is read as {@code column == True}. Column names may be
 * back-quoted to allow spaces or reserved words.
 */
public final class MaskParser {

  private enum Kind { IDENT, QUOTED_IDENT, NUMBER, STRING, OP, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, AND, OR, NOT, IN, END }

  private record Token(Kind kind, String text, int pos) {
  }

  private final String source;
  private final List<Token> tokens;
  private int index;

  private MaskParser(String source) {
    this.source = source;
    this.tokens = tokenize(source);
  }

  /**
   * Parse a mask expression.
   *
   * @param expression the expression text
   * @return the root node
   * @throws InvalidConfigParamException if the expression is blank or malformed
   */
  public static MaskNode parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidConfigParamException("mask", "Mask expression is empty");
    }
    MaskParser parser = new MaskParser(expression);
    MaskNode node = parser.parseOr();
    if (parser.peek().kind != Kind.END) {
      throw parser.error("unexpected '" + parser.peek().text + "'");
    }
    return node;
  }

  private MaskNode parseOr() {
    List<MaskNode> nodes = new ArrayList<>();
    nodes.add(parseAnd());
    while (peek().kind == Kind.OR) {
      index++;
      nodes.add(parseAnd());
    }
    return nodes.size() == 1 ? nodes.get(0) : new ConjugateNode(ConjugateType.OR, nodes);
  }

  private MaskNode parseAnd() {
    List<MaskNode> nodes = new ArrayList<>();
    nodes.add(parseNot());
    while (peek().kind == Kind.AND) {
      index++;
      nodes.add(parseNot());
    }
    return nodes.size() == 1 ? nodes.get(0) : new ConjugateNode(ConjugateType.AND, nodes);
  }

  private MaskNode parseNot() {
    if (peek().kind == Kind.NOT) {
      index++;
      return ConjugateNode.not(parseNot());
    }
    return parsePrimary();
  }

  private MaskNode parsePrimary() {
    if (peek().kind == Kind.LPAREN) {
      index++;
      MaskNode inner = parseOr();
      expect(Kind.RPAREN, "')'");
      return inner;
    }
    Operand left = parseOperand();
    Token next = peek();
    if (next.kind == Kind.OP) {
      index++;
      return new PredicateNode(left, OpType.fromSymbol(next.text), parseOperand());
    }
    if (next.kind == Kind.IN) {
      index++;
      return new PredicateNode(left, OpType.IN, parseList());
    }
    if (next.kind == Kind.NOT && peekAhead(1).kind == Kind.IN) {
      index += 2;
      return new PredicateNode(left, OpType.NOT_IN, parseList());
    }
    if (left instanceof Operand.ColumnRef) {
      return new PredicateNode(left, OpType.EQ, new Operand.Literal(Boolean.TRUE));
    }
    throw error("expected a comparison after " + left);
  }

  private Operand parseOperand() {
    Token token = next();
    switch (token.kind) {
      case QUOTED_IDENT:
        return new Operand.ColumnRef(token.text);
      case IDENT:
        return keywordOrColumn(token.text);
      case NUMBER:
      case STRING:
        return new Operand.Literal(literalValue(token));
      default:
        throw error("expected a column or value but found '" + token.text + "'", token);
    }
  }

  private Operand.ListLiteral parseList() {
    Kind close;
    if (peek().kind == Kind.LBRACKET) {
      close = Kind.RBRACKET;
    } else if (peek().kind == Kind.LPAREN) {
      close = Kind.RPAREN;
    } else {
      throw error("expected a list after 'in'");
    }
    index++;
    List<Object> values = new ArrayList<>();
    while (peek().kind != close) {
      Operand operand = parseOperand();
      if (!(operand instanceof Operand.Literal)) {
        throw error("list members must be literal values");
      }
      values.add(((Operand.Literal) operand).value());
      if (peek().kind != Kind.COMMA) {
        break;
      }
      index++;
    }
    expect(close, close == Kind.RBRACKET ? "']'" : "')'");
    return new Operand.ListLiteral(values);
  }

  private static Operand keywordOrColumn(String word) {
    switch (word) {
      case "True":
      case "true":
        return new Operand.Literal(Boolean.TRUE);
      case "False":
      case "false":
        return new Operand.Literal(Boolean.FALSE);
      case "None":
      case "null":
        return new Operand.Literal(null);
      default:
        return new Operand.ColumnRef(word);
    }
  }

  private static Object literalValue(Token token) {
    if (token.kind == Kind.STRING) {
      return token.text;
    }
    String text = token.text;
    if (text.contains(".") || text.contains("e") || text.contains("E")) {
      return Double.parseDouble(text);
    }
    BigDecimal value = new BigDecimal(text);
    try {
      return value.longValueExact();
    } catch (ArithmeticException e) {
      return value;
    }
  }

  private Token peek() {
    return tokens.get(index);
  }

  private Token peekAhead(int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  private Token next() {
    Token token = tokens.get(index);
    if (token.kind != Kind.END) {
      index++;
    }
    return token;
  }

  private void expect(Kind kind, String description) {
    if (peek().kind != kind) {
      throw error("expected " + description + " but found '" + peek().text + "'");
    }
    index++;
  }

  private InvalidConfigParamException error(String message) {
    return error(message, peek());
  }

  private InvalidConfigParamException error(String message, Token at) {
    return new InvalidConfigParamException("mask",
        "Invalid mask expression '" + source + "' at position " + at.pos + ": " + message);
  }

  private static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      int start = i;
      switch (c) {
        case '(':
          tokens.add(new Token(Kind.LPAREN, "(", start));
          i++;
          continue;
        case ')':
          tokens.add(new Token(Kind.RPAREN, ")", start));
          i++;
          continue;
        case '[':
          tokens.add(new Token(Kind.LBRACKET, "[", start));
          i++;
          continue;
        case ']':
          tokens.add(new Token(Kind.RBRACKET, "]", start));
          i++;
          continue;
        case ',':
          tokens.add(new Token(Kind.COMMA, ",", start));
          i++;
          continue;
        case '&':
          i += i + 1 < text.length() && text.charAt(i + 1) == '&' ? 2 : 1;
          tokens.add(new Token(Kind.AND, "&", start));
          continue;
        case '|':
          i += i + 1 < text.length() && text.charAt(i + 1) == '|' ? 2 : 1;
          tokens.add(new Token(Kind.OR, "|", start));
          continue;
        case '~':
          tokens.add(new Token(Kind.NOT, "~", start));
          i++;
          continue;
        case '`': {
          int end = text.indexOf('`', i + 1);
          if (end < 0) {
            throw new InvalidConfigParamException("mask",
                "Invalid mask expression '" + text + "': unterminated column quote at position " + start);
          }
          tokens.add(new Token(Kind.QUOTED_IDENT, text.substring(i + 1, end), start));
          i = end + 1;
          continue;
        }
        case '\'':
        case '"': {
          StringBuilder sb = new StringBuilder();
          int j = i + 1;
          while (j < text.length() && text.charAt(j) != c) {
            if (text.charAt(j) == '\\' && j + 1 < text.length()) {
              j++;
            }
            sb.append(text.charAt(j));
            j++;
          }
          if (j >= text.length()) {
            throw new InvalidConfigParamException("mask",
                "Invalid mask expression '" + text + "': unterminated string at position " + start);
          }
          tokens.add(new Token(Kind.STRING, sb.toString(), start));
          i = j + 1;
          continue;
        }
        case '=':
        case '!':
        case '<':
        case '>': {
          boolean twoChar = i + 1 < text.length() && text.charAt(i + 1) == '=';
          String op = twoChar ? text.substring(i, i + 2) : String.valueOf(c);
          if ("!".equals(op)) {
            throw new InvalidConfigParamException("mask",
                "Invalid mask expression '" + text + "': unexpected '!' at position " + start);
          }
          tokens.add(new Token(Kind.OP, op, start));
          i += op.length();
          continue;
        }
        default:
          break;
      }
      if (Character.isDigit(c) || (c == '-' || c == '.') && i + 1 < text.length()
          && Character.isDigit(text.charAt(i + 1))) {
        int j = i + 1;
        while (j < text.length() && (Character.isDigit(text.charAt(j)) || text.charAt(j) == '.'
            || text.charAt(j) == 'e' || text.charAt(j) == 'E'
            || (text.charAt(j) == '-' || text.charAt(j) == '+')
            && (text.charAt(j - 1) == 'e' || text.charAt(j - 1) == 'E'))) {
          j++;
        }
        tokens.add(new Token(Kind.NUMBER, text.substring(i, j), start));
        i = j;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int j = i + 1;
        while (j < text.length() && (Character.isLetterOrDigit(text.charAt(j)) || text.charAt(j) == '_')) {
          j++;
        }
        String word = text.substring(i, j);
        switch (word.toLowerCase(Locale.ROOT)) {
          case "and":
            tokens.add(new Token(Kind.AND, word, start));
            break;
          case "or":
            tokens.add(new Token(Kind.OR, word, start));
            break;
          case "not":
            tokens.add(new Token(Kind.NOT, word, start));
            break;
          case "in":
            tokens.add(new Token(Kind.IN, word, start));
            break;
          default:
            tokens.add(new Token(Kind.IDENT, word, start));
        }
        i = j;
        continue;
      }
      throw new InvalidConfigParamException("mask",
          "Invalid mask expression '" + text + "': unexpected character '" + c + "' at position " + start);
    }
    tokens.add(new Token(Kind.END, "<end>", text.length()));
    return tokens;
  }
}
