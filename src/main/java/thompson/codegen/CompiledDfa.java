package thompson.codegen;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import thompson.graph.Dfa;

/**
 * Compiles DFAs into JVM classes.
 *
 * <p>The generated class implements {@link CompiledMatcher} and is defined as
 * a hidden class next to this one, so it can be unloaded along with the
 * matcher instance.
 *
 * @author regex-thompson authors
 */
public final class CompiledDfa {

  private static final Logger logger = Logger.getLogger("thompson");

  /**
   * Name of generated classes (the JVM appends a suffix to hidden classes).
   */
  static final String CLASS_NAME = "thompson/codegen/CompiledDfa$Matcher";

  private CompiledDfa() { }

  /**
   * Code generator for a matcher class.
   *
   * @param dfa DFA to encode
   * @param className internal name of the class to generate
   * @return bytes of a class implementing {@link CompiledMatcher}
   * @throws MethodTooLargeException if the DFA has too many states or transitions
   */
  public static byte[] generateMatcherClass(Dfa dfa, String className) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.COMPILEDMATCHER_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final MethodVisitor mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `matches` method
    {
      final MethodVisitor mv = Method.MATCHES_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new DfaMethodCodegen(mv, dfa).visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    final byte[] classBytes = cw.toByteArray();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
        "Generated " + classBytes.length + " bytes of bytecode for " + dfa.states().size() + " DFA states"
      );
    }
    return classBytes;
  }

  /**
   * Generate, load and instantiate a matcher for a DFA.
   *
   * @param dfa DFA to compile
   * @return matcher accepting exactly the strings the DFA accepts
   * @throws IllegalStateException if the DFA is too large for one method or the class can't be loaded
   */
  public static CompiledMatcher load(Dfa dfa) {
    final byte[] classBytes;
    try {
      classBytes = generateMatcherClass(dfa, CLASS_NAME);
    } catch (MethodTooLargeException error) {
      throw new IllegalStateException(
        "DFA with " + dfa.states().size() + " states is too large to compile to bytecode",
        error
      );
    }

    // Load the class and get a handle on the constructor
    final MethodHandle constructor;
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      constructor = lookup.findConstructor(lookup.lookupClass(), MethodType.methodType(void.class));
    } catch (IllegalAccessException | NoSuchMethodException error) {
      throw new IllegalStateException("Failed to load compiled DFA", error);
    }

    try {
      return (CompiledMatcher) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct compiled DFA", error);
    }
  }
}
