package thompson.codegen;

import java.util.LinkedHashMap;
import java.util.Map;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import thompson.graph.CodeUnit;
import thompson.graph.Dfa;
import thompson.graph.StateSet;

/**
 * Functionality for generating the body of a DFA matching method.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks with transitions encoded
 * as jumps to other blocks. Reading a character with no transition out of the
 * current state jumps straight to the failure block.
 *
 * <p>The generated method has the signature {@code boolean matches(CharSequence)}.
 *
 * @author regex-thompson authors
 */
class DfaMethodCodegen extends BytecodeHelpers {

  /**
   * DFA for which code is generated.
   */
  private final Dfa dfa;

  /**
   * Offset for the argument of type {@code CharSequence}, corresponding to the
   * input string ({@code 0} holds {@code this}).
   */
  private final int inputLocal = 1;

  /**
   * Offset for a local of type {@code int} holding the offset of the next
   * character to read.
   */
  private final int offsetLocal = 2;

  /**
   * Offset for a local of type {@code int} holding the input length.
   */
  private final int lengthLocal = 3;

  /**
   * Labels associated with DFA states.
   *
   * <p>Each DFA state has a label and going to a new state is as simple as
   * jumping to that label.
   */
  private final Map<StateSet, Label> stateLabels;

  /**
   * Label for the block which ends in a positive match being returned.
   */
  private final Label returnSuccess = new Label();

  /**
   * Label for the block which ends in a negative match being returned.
   */
  private final Label returnFailure = new Label();

  DfaMethodCodegen(MethodVisitor mv, Dfa dfa) {
    super(mv);
    this.dfa = dfa;

    final var labels = new LinkedHashMap<StateSet, Label>();
    for (StateSet state : dfa.states()) {
      labels.put(state, new Label());
    }
    this.stateLabels = labels;
  }

  void visitDfa() {

    // offset = 0; length = input.length()
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(dfa.startState()));

    // Lay out the blocks for each state
    for (Map.Entry<StateSet, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      visitState(entry.getKey());
    }

    visitReturn(returnSuccess, true);
    visitReturn(returnFailure, false);
  }

  /**
   * Emit the block for one state.
   *
   * <p>Out of input, the block returns whether the state accepts. Otherwise it
   * reads the next character, advances the offset and branches on the
   * character.
   */
  private void visitState(StateSet state) {
    final boolean accepting = dfa.acceptStates().contains(state);

    // No way out and not accepting: the rest of the input doesn't matter
    if (!accepting && isDead(state)) {
      mv.visitJumpInsn(Opcodes.GOTO, returnFailure);
      return;
    }

    // if (offset >= length) return accepting
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
    mv.visitJumpInsn(Opcodes.IF_ICMPGE, accepting ? returnSuccess : returnFailure);

    // input.charAt(offset++)
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitIincInsn(offsetLocal, 1);

    visitTransitions(dfa.transitions(state));
  }

  /**
   * Branch on the character at the top of the stack.
   *
   * @param transitions transitions out of the current state, sorted by code unit
   */
  private void visitTransitions(Map<CodeUnit, StateSet> transitions) {
    final int[] codeUnits = new int[transitions.size()];
    final Label[] targets = new Label[transitions.size()];
    int i = 0;
    for (Map.Entry<CodeUnit, StateSet> transition : transitions.entrySet()) {
      codeUnits[i] = transition.getKey().value();
      targets[i] = stateLabels.get(transition.getValue());
      i++;
    }
    visitLookupBranch(returnFailure, codeUnits, targets);
  }

  private void visitReturn(Label label, boolean result) {
    mv.visitLabel(label);
    mv.visitInsn(result ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Check if every transition out of a state loops back to it.
   */
  private boolean isDead(StateSet state) {
    return dfa
      .transitions(state)
      .values()
      .stream()
      .allMatch(state::equals);
  }
}
