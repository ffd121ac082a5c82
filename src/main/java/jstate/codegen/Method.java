package jstate.codegen;

import jstate.MachineState;
import java.lang.invoke.MethodType;
import java.util.Set;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Helper class to simplify codegen around declaring and calling methods.
 *
 * @param name name of the method
 * @param typ type of the method (does not include the receiver)
 * @param invokeSort one of the {@code Opcodes.INVOKE*} codes
 */
final record Method(
  String name,
  MethodType typ,
  int invokeSort
) {

  // Class name constants
  public static final String MACHINESTATE_CLASS_NAME = Type.getInternalName(MachineState.class);
  public static final String OBJECT_CLASS_NAME = Type.getInternalName(Object.class);
  public static final String STRING_CLASS_NAME = Type.getInternalName(String.class);
  public static final String SET_CLASS_NAME = Type.getInternalName(Set.class);

  // Method name constants
  public static final Method EMPTYINIT_M = new Method(
    "<init>",
    MethodType.methodType(void.class),
    Opcodes.INVOKESPECIAL
  );
  public static final Method MACHINENAME_M = new Method(
    "machineName",
    MethodType.methodType(String.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method STATENAME_M = new Method(
    "stateName",
    MethodType.methodType(String.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ISTERMINAL_M = new Method(
    "isTerminal",
    MethodType.methodType(boolean.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method TRANSITIONNAMES_M = new Method(
    "transitionNames",
    MethodType.methodType(Set.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method NEXTSTATE_M = new Method(
    "nextState",
    MethodType.methodType(MachineState.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method TRANSITION_M = new Method(
    "transition",
    MethodType.methodType(MachineState.class, String.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method SUPERTRANSITION_M = new Method(
    "transition",
    MethodType.methodType(MachineState.class, String.class),
    Opcodes.INVOKESPECIAL
  );
  public static final Method EQUALS_M = new Method(
    "equals",
    MethodType.methodType(boolean.class, Object.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method SETOF_M = new Method(
    "of",
    MethodType.methodType(Set.class, Object[].class),
    Opcodes.INVOKESTATIC
  );

  // Zero-argument methods every state inherits from `MachineState` or `Object`
  private static final Set<String> INHERITED_NO_ARG_METHODS = Set.of(
    "machineName", "stateName", "isTerminal", "transitionNames", "nextState",
    "getClass", "hashCode", "toString", "clone", "finalize", "notify", "notifyAll", "wait"
  );

  /**
   * Does a transition get a binding method of its own? Transitions named like
   * an inherited zero-argument method do not, since the binding would clash
   * with (or override) that method.
   *
   * @param transitionName name of the transition
   * @return whether a binding method is generated
   */
  public static boolean hasTransitionBinding(String transitionName) {
    return !INHERITED_NO_ARG_METHODS.contains(transitionName);
  }

  /**
   * Zero-argument method moving to the state at the other end of a transition.
   *
   * @param transitionName name of the transition (and of the method)
   * @return method constructing the successor state
   */
  public static Method transitionBinding(String transitionName) {
    return new Method(
      transitionName,
      MethodType.methodType(MachineState.class),
      Opcodes.INVOKEVIRTUAL
    );
  }

  /**
   * Start this method on an existing class visitor.
   *
   * @param cv class on which the method is started
   * @param accessFlags access flags for the method (`static` or not is computed)
   * @return method visitor for this method
   */
  public MethodVisitor newMethod(ClassVisitor cv, int accessFlags) {
    int staticFlag = (invokeSort == Opcodes.INVOKESTATIC) ? Opcodes.ACC_STATIC : 0;
    return cv.visitMethod(
      accessFlags | staticFlag,
      name,
      typ.descriptorString(),
      null, // signature
      null  // exceptions
    );
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className name of the class on which this method is defined
   */
  public void invokeMethod(MethodVisitor mv, String className) {
    invokeMethod(mv, className, invokeSort == Opcodes.INVOKEINTERFACE);
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className name of the class on which this method is defined
   * @param onInterface is the owner an interface (eg. for static interface methods)?
   */
  public void invokeMethod(MethodVisitor mv, String className, boolean onInterface) {
    mv.visitMethodInsn(
      invokeSort,
      className,
      name,
      typ.descriptorString(),
      onInterface
    );
  }
}
