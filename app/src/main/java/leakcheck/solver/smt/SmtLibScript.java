package leakcheck.solver.smt;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import leakcheck.diagnostics.TranslationException;
import leakcheck.ir.Expression;
import leakcheck.ir.Operator.Opcode;
import leakcheck.ir.Variable;

/** A self-contained SMT-LIB v2 query: declarations, assertions, {@code check-sat}. */
public final class SmtLibScript {
  private static final int DEFAULT_ADDRESS_WIDTH = 64;

  private final SortedSet<Variable> declarations = new TreeSet<>();
  private final List<SmtLibTerm> assertions = new ArrayList<>();
  private int addressWidth = -1;

  public static SmtLibScript of(List<Expression> assertions) throws TranslationException {
    SmtLibScript script = new SmtLibScript();
    for (Expression assertion : assertions) {
      script.assertion(assertion);
    }
    return script;
  }

  /** Adds an assertion, declaring its free variables. */
  public SmtLibScript assertion(Expression assertion) throws TranslationException {
    if (!assertion.sort().isBool()) {
      throw new TranslationException(
          "assertion " + assertion + " must be Bool but is " + assertion.sort().describe());
    }
    SmtLibTerm term = SmtLibTerm.translate(assertion);
    recordAddressWidth(assertion);
    declarations.addAll(assertion.variables());
    assertions.add(term);
    return this;
  }

  private void recordAddressWidth(Expression expression) throws TranslationException {
    if (expression.hasOpcode(Opcode.LOAD) || expression.hasOpcode(Opcode.STORE)) {
      int width = expression.operand(1).sort().width();
      if (addressWidth >= 0 && addressWidth != width) {
        throw new TranslationException(
            "memory is addressed with both " + addressWidth + " and " + width + " bits");
      }
      addressWidth = width;
    }
    for (Expression operand : expression.operands()) {
      recordAddressWidth(operand);
    }
  }

  public List<SmtLibTerm> assertions() {
    return List.copyOf(assertions);
  }

  public String render() {
    int width = addressWidth < 0 ? DEFAULT_ADDRESS_WIDTH : addressWidth;
    StringBuilder sb = new StringBuilder("(set-logic QF_ABV)\n");
    for (Variable variable : declarations) {
      sb.append("(declare-const ")
          .append(SmtLibTerm.symbol(variable.name()))
          .append(' ')
          .append(SmtLibTerm.sortName(variable.sort(), width))
          .append(")\n");
    }
    for (SmtLibTerm assertion : assertions) {
      sb.append("(assert ").append(assertion.text()).append(")\n");
    }
    return sb.append("(check-sat)\n(get-model)\n").toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
