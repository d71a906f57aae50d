package leakcheck.lift;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.diagnostics.TranslationException;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.lift.AssemblyInstruction.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for µASM, the small assembly language of speculative-execution litmus tests.
 *
 * <pre>
 *   # comment (also //)
 *   label:
 *   skip | spbarr | flush
 *   r &lt;- expr
 *   cmov cond, r &lt;- expr
 *   load r, addr        r = mem[addr]
 *   store r, addr       mem[addr] = r
 *   jmp target
 *   beqz r, target
 * </pre>
 *
 * <p>Expressions are 64-bit with C precedence: {@code ?:}, {@code |}, {@code ^}, {@code &},
 * {@code == !=}, {@code < <= > >=} (unsigned), {@code << >> >>>} ({@code >>} is arithmetic),
 * {@code + -}, {@code * / %} (unsigned), unary {@code - ~ !}. Comparisons and {@code !} yield 0 or
 * 1; a condition holds when it is non-zero. A target is a label or an instruction address.
 */
public final class MuasmParser {
  private static final Logger LOG = LoggerFactory.getLogger(MuasmParser.class);

  private static final Set<String> MNEMONICS =
      Set.of("skip", "spbarr", "fence", "flush", "cmov", "load", "store", "jmp", "beqz");
  private static final int WIDTH = AssemblyProgram.WORD_SIZE;

  private MuasmParser() {}

  public static AssemblyProgram parse(Path path) throws AnalysisException {
    String source;
    try {
      source = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new AnalysisException(ErrorKind.IO, "cannot read " + path + ": " + ex.getMessage(), ex);
    }
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return parse(dot > 0 ? fileName.substring(0, dot) : fileName, source);
  }

  public static AssemblyProgram parse(String name, String source) throws TranslationException {
    List<AssemblyInstruction> instructions = new ArrayList<>();
    Map<String, Integer> labels = new LinkedHashMap<>();
    String[] lines = source.split("\\R", -1);
    for (int i = 0; i < lines.length; i++) {
      int lineNumber = i + 1;
      LineParser parser = new LineParser(tokenize(lines[i], lineNumber), lineNumber);
      while (parser.atLabel()) {
        String label = parser.next();
        parser.expect(":");
        if (labels.putIfAbsent(label, instructions.size()) != null) {
          throw parser.error("duplicate label `" + label + "`");
        }
      }
      if (!parser.atEnd()) {
        instructions.add(parser.instruction(instructions.size()));
      }
    }
    LOG.debug(
        "Parsed {} instruction(s) and {} label(s) from {}",
        instructions.size(),
        labels.size(),
        name);
    return new AssemblyProgram(name, instructions, labels);
  }

  static List<String> tokenize(String line, int lineNumber) throws TranslationException {
    List<String> tokens = new ArrayList<>();
    int i = 0;
    while (i < line.length()) {
      char c = line.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '#' || line.startsWith("//", i)) {
        break;
      } else if (Character.isLetterOrDigit(c) || c == '_') {
        int start = i;
        while (i < line.length()
            && (Character.isLetterOrDigit(line.charAt(i))
                || line.charAt(i) == '_'
                || line.charAt(i) == '.')) {
          i++;
        }
        tokens.add(line.substring(start, i));
      } else {
        String symbol = symbolAt(line, i);
        if (symbol == null) {
          throw new TranslationException(
              "line " + lineNumber + ": unexpected character `" + c + "`");
        }
        tokens.add(symbol);
        i += symbol.length();
      }
    }
    return tokens;
  }

  private static String symbolAt(String line, int index) {
    for (String symbol : List.of(">>>", "<-", "<<", "<=", ">>", ">=", "==", "!=")) {
      if (line.startsWith(symbol, index)) {
        return symbol;
      }
    }
    char c = line.charAt(index);
    return "(),:?+-*/%&|^~!<>".indexOf(c) >= 0 ? String.valueOf(c) : null;
  }

  /** Recursive descent over the tokens of one line. */
  private static final class LineParser {
    /** Binary operators from loosest to tightest binding. */
    private static final List<List<String>> LEVELS =
        List.of(
            List.of("|"),
            List.of("^"),
            List.of("&"),
            List.of("==", "!="),
            List.of("<", "<=", ">", ">="),
            List.of("<<", ">>", ">>>"),
            List.of("+", "-"),
            List.of("*", "/", "%"));

    private final List<String> tokens;
    private final int line;
    private int position;

    LineParser(List<String> tokens, int line) {
      this.tokens = tokens;
      this.line = line;
    }

    boolean atEnd() {
      return position >= tokens.size();
    }

    boolean atLabel() {
      return position + 1 < tokens.size()
          && isIdentifier(tokens.get(position))
          && tokens.get(position + 1).equals(":");
    }

    String peek() {
      return atEnd() ? "<end of line>" : tokens.get(position);
    }

    String next() throws TranslationException {
      if (atEnd()) {
        throw error("unexpected end of line");
      }
      return tokens.get(position++);
    }

    boolean accept(String token) {
      if (!atEnd() && tokens.get(position).equals(token)) {
        position++;
        return true;
      }
      return false;
    }

    void expect(String token) throws TranslationException {
      if (!accept(token)) {
        throw error("expected `" + token + "` but found `" + peek() + "`");
      }
    }

    TranslationException error(String message) {
      return new TranslationException("line " + line + ": " + message);
    }

    AssemblyInstruction instruction(int address) throws TranslationException {
      String head = next();
      AssemblyInstruction instruction =
          switch (head) {
            case "skip" -> AssemblyInstruction.simple(address, line, Opcode.SKIP);
            case "spbarr", "fence" -> AssemblyInstruction.simple(address, line, Opcode.BARRIER);
            case "flush" -> AssemblyInstruction.simple(address, line, Opcode.FLUSH);
            case "cmov" -> {
              Expression condition = expression();
              expect(",");
              Variable register = register(next());
              expect("<-");
              yield AssemblyInstruction.conditionalAssign(
                  address, line, condition, register, expression());
            }
            case "load", "store" -> {
              Variable register = register(next());
              expect(",");
              Opcode opcode = head.equals("load") ? Opcode.LOAD : Opcode.STORE;
              yield AssemblyInstruction.withRegister(address, line, opcode, register, expression());
            }
            case "jmp" -> AssemblyInstruction.jump(address, line, target());
            case "beqz" -> {
              Variable register = register(next());
              expect(",");
              yield AssemblyInstruction.branchIfZero(address, line, register, target());
            }
            default -> {
              Variable register = register(head);
              expect("<-");
              yield AssemblyInstruction.withRegister(
                  address, line, Opcode.ASSIGN, register, expression());
            }
          };
      if (!atEnd()) {
        throw error("unexpected `" + peek() + "` after `" + instruction + "`");
      }
      return instruction;
    }

    private String target() throws TranslationException {
      String target = next();
      if (!isIdentifier(target) && !Character.isDigit(target.charAt(0))) {
        throw error("expected a jump target but found `" + target + "`");
      }
      return target;
    }

    private Variable register(String token) throws TranslationException {
      if (!isIdentifier(token) || MNEMONICS.contains(token)) {
        throw error("expected a register but found `" + token + "`");
      }
      return Variable.bitVector(token, WIDTH);
    }

    Expression expression() throws TranslationException {
      try {
        return conditional();
      } catch (SortMismatchException ex) {
        throw new TranslationException("line " + line + ": " + ex.getMessage(), ex);
      }
    }

    private Expression conditional() throws TranslationException, SortMismatchException {
      Expression condition = binary(0);
      if (!accept("?")) {
        return condition;
      }
      Expression then = conditional();
      expect(":");
      Expression otherwise = conditional();
      return Expression.ite(nonZero(condition), then, otherwise);
    }

    private Expression binary(int level) throws TranslationException, SortMismatchException {
      if (level == LEVELS.size()) {
        return unary();
      }
      Expression lhs = binary(level + 1);
      while (!atEnd() && LEVELS.get(level).contains(tokens.get(position))) {
        String operator = next();
        Expression rhs = binary(level + 1);
        lhs = combine(operator, lhs, rhs);
      }
      return lhs;
    }

    private static Expression combine(String operator, Expression lhs, Expression rhs)
        throws SortMismatchException {
      return switch (operator) {
        case "|" -> Expression.bvOr(lhs, rhs);
        case "^" -> Expression.bvXor(lhs, rhs);
        case "&" -> Expression.bvAnd(lhs, rhs);
        case "==" -> flag(Expression.equal(lhs, rhs));
        case "!=" -> flag(Expression.unequal(lhs, rhs));
        case "<" -> flag(Expression.ult(lhs, rhs));
        case "<=" -> flag(Expression.ule(lhs, rhs));
        case ">" -> flag(Expression.ult(rhs, lhs));
        case ">=" -> flag(Expression.ule(rhs, lhs));
        case "<<" -> Expression.shl(lhs, rhs);
        case ">>" -> Expression.ashr(lhs, rhs);
        case ">>>" -> Expression.lshr(lhs, rhs);
        case "+" -> Expression.add(lhs, rhs);
        case "-" -> Expression.sub(lhs, rhs);
        case "*" -> Expression.mul(lhs, rhs);
        case "/" -> Expression.udiv(lhs, rhs);
        case "%" -> Expression.urem(lhs, rhs);
        default -> throw new IllegalStateException("unknown operator " + operator);
      };
    }

    private Expression unary() throws TranslationException, SortMismatchException {
      if (accept("-")) {
        return Expression.neg(unary());
      }
      if (accept("~")) {
        return Expression.bvNot(unary());
      }
      if (accept("!")) {
        return flag(Expression.equal(unary(), zero()));
      }
      if (accept("(")) {
        Expression inner = conditional();
        expect(")");
        return inner;
      }
      String token = next();
      if (Character.isDigit(token.charAt(0))) {
        return Expression.constant(literal(token));
      }
      return register(token).toExpression();
    }

    private Constant literal(String token) throws TranslationException {
      String digits = token.replace("_", "");
      BigInteger value;
      try {
        value =
            digits.startsWith("0x") || digits.startsWith("0X")
                ? new BigInteger(digits.substring(2), 16)
                : new BigInteger(digits);
      } catch (NumberFormatException ex) {
        throw error("malformed number `" + token + "`");
      }
      if (value.bitLength() > WIDTH) {
        throw error("number `" + token + "` does not fit in " + WIDTH + " bits");
      }
      return Constant.bitVector(value, WIDTH);
    }

    private static Expression flag(Expression condition) throws SortMismatchException {
      return Expression.ite(condition, Expression.bitVector(1, WIDTH), zero());
    }

    private static Expression nonZero(Expression value) throws SortMismatchException {
      return Expression.unequal(value, zero());
    }

    private static Expression zero() {
      return Expression.bitVector(0, WIDTH);
    }

    private static boolean isIdentifier(String token) {
      char first = token.charAt(0);
      return Character.isLetter(first) || first == '_';
    }
  }
}
