package leakcheck.solver.smt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.diagnostics.TranslationException;
import leakcheck.ir.Expression;
import leakcheck.ir.Operator;
import leakcheck.ir.Sort;
import leakcheck.pass.TryTranslateFrom;

/**
 * An expression rendered in SMT-LIB v2 syntax over the theories of bit-vectors and arrays.
 *
 * <p>Memory becomes an array from addresses to bytes; multi-byte loads and stores are expanded
 * into little-endian {@code select}/{@code store} chains.
 */
public record SmtLibTerm(String text, Sort sort) {
  private static final Pattern SIMPLE_SYMBOL =
      Pattern.compile("[A-Za-z~!@$%^&*_+=<>.?/\\-][A-Za-z0-9~!@$%^&*_+=<>.?/\\-]*");

  public static final TryTranslateFrom<Expression, SmtLibTerm> FROM_EXPRESSION =
      SmtLibTerm::translate;

  public SmtLibTerm {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(sort, "sort");
  }

  /** Translates a well-typed expression; ill-typed input is rejected as a whole. */
  public static SmtLibTerm translate(Expression expression) throws TranslationException {
    try {
      expression.validate();
    } catch (SortMismatchException ex) {
      throw new TranslationException("cannot translate ill-typed " + expression, ex);
    }
    return new SmtLibTerm(render(expression), expression.sort());
  }

  public static String symbol(String name) {
    if (SIMPLE_SYMBOL.matcher(name).matches()) {
      return name;
    }
    return "|" + name.replace("|", "_").replace("\\", "_") + "|";
  }

  /** SMT-LIB sort; memory needs the address width of the accesses that use it. */
  public static String sortName(Sort sort, int addressWidth) {
    return switch (sort.kind()) {
      case BOOL -> "Bool";
      case BIT_VECTOR -> bitVecSort(sort.width());
      case MEMORY -> "(Array " + bitVecSort(addressWidth) + " " + bitVecSort(8) + ")";
    };
  }

  private static String bitVecSort(int width) {
    return "(_ BitVec " + width + ")";
  }

  private static String render(Expression expression) {
    if (expression.isConstant()) {
      if (expression.constant().isBool()) {
        return Boolean.toString(expression.constant().booleanValue());
      }
      return "(_ bv" + expression.constant().value() + " " + expression.constant().width() + ")";
    }
    if (expression.isVariable()) {
      return symbol(expression.variable().name());
    }
    Operator operator = expression.operator();
    List<String> operands = new ArrayList<>(expression.operands().size());
    for (Expression operand : expression.operands()) {
      operands.add(render(operand));
    }
    return switch (operator.opcode()) {
      case UNEQUAL -> application("distinct", operands);
      case EXTRACT ->
          application(
              "(_ extract " + operator.highestBit() + " " + operator.lowestBit() + ")", operands);
      case ZERO_EXTEND ->
          application(
              "(_ zero_extend " + (operator.width() - expression.operand(0).sort().width()) + ")",
              operands);
      case SIGN_EXTEND ->
          application(
              "(_ sign_extend " + (operator.width() - expression.operand(0).sort().width()) + ")",
              operands);
      case TRUNCATE -> application("(_ extract " + (operator.width() - 1) + " 0)", operands);
      case LOAD -> load(operator.width() / 8, operands.get(0), expression.operand(1));
      case STORE -> store(operands.get(0), expression.operand(1), expression.operand(2));
      default -> application(operator.opcode().symbol(), operands);
    };
  }

  private static String application(String head, List<String> operands) {
    return "(" + head + " " + String.join(" ", operands) + ")";
  }

  private static String byteAddress(Expression address, int offset) {
    String base = render(address);
    if (offset == 0) {
      return base;
    }
    return "(bvadd " + base + " (_ bv" + offset + " " + address.sort().width() + "))";
  }

  private static String load(int bytes, String memory, Expression address) {
    if (bytes == 1) {
      return "(select " + memory + " " + byteAddress(address, 0) + ")";
    }
    List<String> parts = new ArrayList<>(bytes);
    for (int i = bytes - 1; i >= 0; i--) {
      parts.add("(select " + memory + " " + byteAddress(address, i) + ")");
    }
    return application("concat", parts);
  }

  private static String store(String memory, Expression address, Expression value) {
    String renderedValue = render(value);
    String result = memory;
    for (int i = 0; i < value.sort().width() / 8; i++) {
      String part = "((_ extract " + (8 * i + 7) + " " + (8 * i) + ") " + renderedValue + ")";
      result = "(store " + result + " " + byteAddress(address, i) + " " + part + ")";
    }
    return result;
  }

  @Override
  public String toString() {
    return text;
  }
}
