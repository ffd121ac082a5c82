package jstate.codegen;

import jstate.graph.StateGraph;
import jstate.graph.SuccessorGraph;
import jstate.graph.TransitionGraph;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Code generator turning a state graph directly into JVM classes.
 *
 * <p>The class layout mirrors the generated Java source: an abstract base
 * class named after the machine extending {@code jstate.MachineState}, and one
 * final subclass per state. Successors are encoded as constructor calls, and
 * named transitions as a chain of string comparisons falling back to the
 * failing {@code MachineState.transition(String)}.
 */
public final class MachineClassCodegen {

  private static final Logger logger = LogManager.getLogger(MachineClassCodegen.class.getSimpleName());

  /**
   * Package (in internal form) in which all machine classes are generated.
   */
  public static final String GENERATED_PACKAGE = "jstate/generated";

  private MachineClassCodegen() { }

  /**
   * Generate the classes for a state machine.
   *
   * @param graph graph of the machine
   * @return generated classes
   */
  public static GeneratedMachine generate(StateGraph graph) {
    final String baseClass = GENERATED_PACKAGE + "/" + graph.name();

    final var stateClasses = new LinkedHashMap<String, String>();
    for (String state : graph.states()) {
      stateClasses.put(state, baseClass + "$" + state);
    }

    final var classFiles = new LinkedHashMap<String, byte[]>();
    classFiles.put(binaryName(baseClass), generateBaseClass(graph.name(), baseClass).toByteArray());
    for (Map.Entry<String, String> entry : stateClasses.entrySet()) {
      final byte[] classBytes = generateStateClass(graph, entry.getKey(), baseClass, stateClasses).toByteArray();
      classFiles.put(binaryName(entry.getValue()), classBytes);
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Generated " + classFiles.size() + " classes for state machine " + graph.name());
    }

    final var stateClassNames = new LinkedHashMap<String, String>();
    stateClasses.forEach((state, className) -> stateClassNames.put(state, binaryName(className)));
    return new GeneratedMachine(binaryName(baseClass), stateClassNames, classFiles);
  }

  private static String binaryName(String internalName) {
    return internalName.replace('/', '.');
  }

  /**
   * Class writer which does not try to load generated classes when computing
   * stack map frames.
   */
  private static ClassWriter newClassWriter() {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    return new ClassWriter(ClassWriter.COMPUTE_FRAMES) {
      @Override
      protected String getCommonSuperClass(String type1, String type2) {
        final boolean generated1 = type1.startsWith(GENERATED_PACKAGE + "/");
        final boolean generated2 = type2.startsWith(GENERATED_PACKAGE + "/");
        if (generated1 && generated2) {
          return Method.MACHINESTATE_CLASS_NAME;
        } else if (generated1 || generated2) {
          return Method.OBJECT_CLASS_NAME;
        }
        return super.getCommonSuperClass(type1, type2);
      }
    };
  }

  private static ClassWriter generateBaseClass(String machine, String baseClass) {
    final var cw = newClassWriter();
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER | Opcodes.ACC_ABSTRACT,
      baseClass,
      null, // signature
      Method.MACHINESTATE_CLASS_NAME,
      null  // interfaces
    );

    // Constructor
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PROTECTED);
      mv.visitCode();
      new BytecodeHelpers(mv).visitSuperInit(Method.MACHINESTATE_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `machineName` method
    {
      final var mv = Method.MACHINENAME_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      mv.visitCode();
      mv.visitLdcInsn(machine);
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  private static ClassWriter generateStateClass(
    StateGraph graph,
    String state,
    String baseClass,
    Map<String, String> stateClasses
  ) {
    final String stateClass = stateClasses.get(state);
    final var cw = newClassWriter();
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER | Opcodes.ACC_FINAL,
      stateClass,
      null, // signature
      baseClass,
      null  // interfaces
    );

    // Constructor
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new BytecodeHelpers(mv).visitSuperInit(baseClass);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `stateName` method
    {
      final var mv = Method.STATENAME_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitLdcInsn(state);
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `isTerminal` method
    {
      final var mv = Method.ISTERMINAL_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new BytecodeHelpers(mv).visitConstantBoolean(graph.isTerminal(state));
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    if (graph instanceof SuccessorGraph successorGraph) {
      final Optional<String> successor = successorGraph.successor(state);
      if (successor.isPresent()) {
        generateNextState(cw, stateClasses.get(successor.get()));
      }
    } else if (graph instanceof TransitionGraph transitionGraph) {
      generateTransitions(cw, transitionGraph.transitionsFrom(state), baseClass, stateClasses);
    } else {
      throw new IllegalArgumentException("Unknown state graph " + graph);
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Generate the {@code nextState} override of a state with a successor.
   */
  private static void generateNextState(ClassWriter cw, String successorClass) {
    final var mv = Method.NEXTSTATE_M.newMethod(cw, Opcodes.ACC_PUBLIC);
    mv.visitCode();
    new BytecodeHelpers(mv).visitNewInstance(successorClass);
    mv.visitInsn(Opcodes.ARETURN);
    mv.visitMaxs(0, 0);
    mv.visitEnd();
  }

  /**
   * Generate {@code transitionNames}, {@code transition(String)}, and one
   * binding method per supported transition.
   *
   * @param cw class being generated
   * @param transitions transitions out of the state, to their successor state
   * @param baseClass internal name of the machine's base class
   * @param stateClasses internal name of the class of each state
   */
  private static void generateTransitions(
    ClassWriter cw,
    Map<String, String> transitions,
    String baseClass,
    Map<String, String> stateClasses
  ) {

    // `transitionNames` method
    {
      final var mv = Method.TRANSITIONNAMES_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new BytecodeHelpers(mv).visitConstantStringSet(transitions.keySet());
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `transition(String)` method: compare against each supported name in turn
    {
      final int nameLocal = 1;
      final var mv = Method.TRANSITION_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      final var helpers = new BytecodeHelpers(mv);
      mv.visitCode();
      for (Map.Entry<String, String> entry : transitions.entrySet()) {
        final var nextCandidate = new Label();
        mv.visitLdcInsn(entry.getKey());
        mv.visitVarInsn(Opcodes.ALOAD, nameLocal);
        Method.EQUALS_M.invokeMethod(mv, Method.STRING_CLASS_NAME);
        mv.visitJumpInsn(Opcodes.IFEQ, nextCandidate);
        helpers.visitNewInstance(stateClasses.get(entry.getValue()));
        mv.visitInsn(Opcodes.ARETURN);
        mv.visitLabel(nextCandidate);
      }

      // Unsupported transition: `super.transition(name)` throws
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      mv.visitVarInsn(Opcodes.ALOAD, nameLocal);
      Method.SUPERTRANSITION_M.invokeMethod(mv, baseClass);
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // One zero-argument method per supported transition
    for (Map.Entry<String, String> entry : transitions.entrySet()) {
      if (!Method.hasTransitionBinding(entry.getKey())) {
        continue;
      }
      final var mv = Method.transitionBinding(entry.getKey()).newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new BytecodeHelpers(mv).visitNewInstance(stateClasses.get(entry.getValue()));
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }
  }
}
