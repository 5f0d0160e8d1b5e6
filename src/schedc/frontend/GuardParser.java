package schedc.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import schedc.ir.Assignment;
import schedc.ir.Atom;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Port;

/**
 * Parses assignments and guards in the syntax of the IR printer, resolving names against one component.
 * <pre>
 *   assignment := port '=' [guard '?'] atom [';']
 *   guard      := conj ('|' conj)*
 *   conj       := unary ('&amp;' unary)*
 *   unary      := '!' unary | '(' guard ')' | '%' INT | '%[' INT ':' INT ']' | atom [cmp atom]
 *   atom       := WIDTH "'" ('d'|'b'|'h') DIGITS | cell '.' port | group '[' ('go'|'done') ']' | signature port
 * </pre>
 */
public class GuardParser {
  private enum Kind { IDENT, NUMBER, CONST, SYMBOL, END }

  private record Token(Kind kind, String text, int pos) {
    boolean is(String symbol) { return kind == Kind.SYMBOL && text.equals(symbol); }
  }

  private final Component comp;
  private String input = "";
  private List<Token> tokens = List.of();
  private int index = 0;

  public GuardParser(Component comp) { this.comp = comp; }

  public Guard parseGuard(String text) throws FrontendException {
    start(text);
    Guard ret = guard();
    expectEnd();
    return ret;
  }

  public Assignment parseAssignment(String text) throws FrontendException {
    start(text);
    Port dst = port();
    expect("=");
    Guard guard = Guard.TRUE;
    // without '?' the right-hand side is a plain atom
    if (containsSymbol("?")) {
      guard = guard();
      expect("?");
    }
    Atom src = atom();
    if (peek().is(";"))
      next();
    expectEnd();
    return new Assignment(dst, src, guard);
  }

  public Atom parseAtom(String text) throws FrontendException {
    start(text);
    Atom ret = atom();
    expectEnd();
    return ret;
  }

  public Port parsePort(String text) throws FrontendException {
    start(text);
    Port ret = port();
    expectEnd();
    return ret;
  }

  private void start(String text) throws FrontendException {
    input = text;
    tokens = lex(text);
    index = 0;
  }

  private boolean containsSymbol(String symbol) { return tokens.stream().anyMatch(t -> t.is(symbol)); }

  private FrontendException error(String message) {
    Token t = peek();
    String at = t.kind() == Kind.END ? "end of input" : "'" + t.text() + "' (column " + (t.pos() + 1) + ")";
    return new FrontendException(comp.name() + ": " + message + " at " + at + " in \"" + input + "\"");
  }

  private Token peek() { return tokens.get(index); }
  private Token next() { return tokens.get(index++); }

  private void expect(String symbol) throws FrontendException {
    if (!peek().is(symbol))
      throw error("Expected '" + symbol + "'");
    next();
  }

  private void expectEnd() throws FrontendException {
    if (peek().kind() != Kind.END)
      throw error("Unexpected trailing input");
  }

  private static final Set<String> SYMBOLS2 = Set.of("==", "!=", "<=", ">=");
  private static final String SYMBOLS1 = "=<>!&|?()[]%:.;";

  private List<Token> lex(String text) throws FrontendException {
    var ret = new ArrayList<Token>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
        continue;
      }
      int begin = i;
      if (Character.isLetter(c) || c == '_') {
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_'))
          ++i;
        ret.add(new Token(Kind.IDENT, text.substring(begin, i), begin));
      } else if (Character.isDigit(c)) {
        while (i < text.length() && Character.isDigit(text.charAt(i)))
          ++i;
        if (i < text.length() && text.charAt(i) == '\'') {
          ++i;
          while (i < text.length() && Character.isLetterOrDigit(text.charAt(i)))
            ++i;
          ret.add(new Token(Kind.CONST, text.substring(begin, i), begin));
        } else
          ret.add(new Token(Kind.NUMBER, text.substring(begin, i), begin));
      } else if (i + 1 < text.length() && SYMBOLS2.contains(text.substring(i, i + 2))) {
        ret.add(new Token(Kind.SYMBOL, text.substring(i, i + 2), begin));
        i += 2;
      } else if (SYMBOLS1.indexOf(c) >= 0) {
        ret.add(new Token(Kind.SYMBOL, String.valueOf(c), begin));
        ++i;
      } else
        throw new FrontendException(comp.name() + ": Unexpected character '" + c + "' at column " + (i + 1) + " in \"" + text + "\"");
    }
    ret.add(new Token(Kind.END, "", text.length()));
    return ret;
  }

  private Guard guard() throws FrontendException {
    Guard ret = conjunction();
    while (peek().is("|")) {
      next();
      ret = new Guard.Or(ret, conjunction());
    }
    return ret;
  }

  private Guard conjunction() throws FrontendException {
    Guard ret = unary();
    while (peek().is("&")) {
      next();
      ret = new Guard.And(ret, unary());
    }
    return ret;
  }

  private Guard unary() throws FrontendException {
    Token t = peek();
    if (t.is("!")) {
      next();
      return new Guard.Not(unary());
    }
    if (t.is("(")) {
      next();
      Guard ret = guard();
      expect(")");
      return ret;
    }
    if (t.is("%"))
      return cycles();
    Atom left = atom();
    Guard.CompOp op = compOp();
    if (op != null)
      return Guard.compare(op, left, atom());
    if (left instanceof Constant) {
      // a constant guard is either always or never true
      return ((Constant)left).value() != 0 ? Guard.TRUE : Guard.FALSE;
    }
    return Guard.port((Port)left);
  }

  private Guard.CompOp compOp() {
    Token t = peek();
    if (t.kind() != Kind.SYMBOL)
      return null;
    for (Guard.CompOp op : Guard.CompOp.values())
      if (op.symbol.equals(t.text())) {
        next();
        return op;
      }
    return null;
  }

  private long number() throws FrontendException {
    if (peek().kind() != Kind.NUMBER)
      throw error("Expected a number");
    return Long.parseLong(next().text());
  }

  private Guard cycles() throws FrontendException {
    expect("%");
    try {
      if (peek().is("[")) {
        next();
        long begin = number();
        expect(":");
        long end = number();
        expect("]");
        return Guard.range(begin, end);
      }
      return Guard.cycle(number());
    } catch (IllegalArgumentException e) {
      throw error(e.getMessage());
    }
  }

  private Atom atom() throws FrontendException {
    if (peek().kind() == Kind.CONST)
      return constant(next());
    return port();
  }

  private Constant constant(Token t) throws FrontendException {
    String text = t.text();
    int quote = text.indexOf('\'');
    if (quote + 2 > text.length())
      throw error("Malformed constant " + text);
    int radix;
    switch (text.charAt(quote + 1)) {
    case 'd':
      radix = 10;
      break;
    case 'b':
      radix = 2;
      break;
    case 'h':
      radix = 16;
      break;
    default:
      throw error("Unknown radix in constant " + text);
    }
    try {
      int width = Integer.parseInt(text.substring(0, quote));
      return Constant.of(Long.parseUnsignedLong(text.substring(quote + 2), radix), width);
    } catch (IllegalArgumentException e) {
      throw new FrontendException(comp.name() + ": Malformed constant " + text + " in \"" + input + "\"", e);
    }
  }

  private Port port() throws FrontendException {
    if (peek().kind() != Kind.IDENT)
      throw error("Expected a port");
    String name = next().text();
    if (peek().is(".")) {
      next();
      if (peek().kind() != Kind.IDENT)
        throw error("Expected a port name after " + name + ".");
      String portName = next().text();
      Cell cell = comp.findCell(name).orElseThrow(() -> new FrontendException(comp.name() + ": Unknown cell " + name + " in \"" + input + "\""));
      if (!cell.hasPort(portName))
        throw new FrontendException(comp.name() + ": Cell " + name + " has no port " + portName + " in \"" + input + "\"");
      return cell.port(portName);
    }
    if (peek().is("[")) {
      next();
      if (peek().kind() != Kind.IDENT)
        throw error("Expected go or done");
      String hole = next().text();
      expect("]");
      Group group = comp.findGroup(name).orElseThrow(() -> new FrontendException(comp.name() + ": Unknown group " + name + " in \"" + input + "\""));
      if (hole.equals("go"))
        return group.go();
      if (hole.equals("done"))
        return group.done();
      throw new FrontendException(comp.name() + ": Groups have no hole " + hole + " in \"" + input + "\"");
    }
    if (!comp.hasPort(name))
      throw new FrontendException(comp.name() + ": Unknown port " + name + " in \"" + input + "\"");
    return comp.port(name);
  }
}
