package jstate.codegen;

import java.util.Collection;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing a bunch of utility methods for emitting bytecode.
 *
 * <p>Some of the utilities could be easily replaced with a single method call
 * on {@code MethodVisitor}, but their benefit is that they emit shorter
 * bytecode.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  public BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Emit code to construct a fresh instance of a class with a no-argument
   * constructor, leaving it on top of the stack.
   *
   * @param className internal name of the class
   */
  protected void visitNewInstance(String className) {
    mv.visitTypeInsn(Opcodes.NEW, className);
    mv.visitInsn(Opcodes.DUP);
    Method.EMPTYINIT_M.invokeMethod(mv, className);
  }

  /**
   * Emit code to call the no-argument constructor of the superclass on
   * {@code this}.
   *
   * @param superClassName internal name of the superclass
   */
  protected void visitSuperInit(String superClassName) {
    mv.visitVarInsn(Opcodes.ALOAD, 0);
    Method.EMPTYINIT_M.invokeMethod(mv, superClassName);
  }

  /**
   * Emit code to build an unmodifiable {@code Set} of constant strings, leaving
   * it on top of the stack.
   *
   * @param values elements of the set (must be distinct)
   */
  protected void visitConstantStringSet(Collection<String> values) {
    visitConstantInt(values.size());
    mv.visitTypeInsn(Opcodes.ANEWARRAY, Method.OBJECT_CLASS_NAME);
    int index = 0;
    for (String value : values) {
      mv.visitInsn(Opcodes.DUP);
      visitConstantInt(index++);
      mv.visitLdcInsn(value);
      mv.visitInsn(Opcodes.AASTORE);
    }
    Method.SETOF_M.invokeMethod(mv, Method.SET_CLASS_NAME, true);
  }

  /**
   * Push a boolean constant onto the stack.
   *
   * @param constant boolean constant
   */
  protected void visitConstantBoolean(boolean constant) {
    mv.visitInsn(constant ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
  }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but possibly shorter
   * and ideally not consuming a slot in the constants table.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    switch (constant) {
      case -1:
        mv.visitInsn(Opcodes.ICONST_M1);
        return;

      case 0:
        mv.visitInsn(Opcodes.ICONST_0);
        return;

      case 1:
        mv.visitInsn(Opcodes.ICONST_1);
        return;

      case 2:
        mv.visitInsn(Opcodes.ICONST_2);
        return;

      case 3:
        mv.visitInsn(Opcodes.ICONST_3);
        return;

      case 4:
        mv.visitInsn(Opcodes.ICONST_4);
        return;

      case 5:
        mv.visitInsn(Opcodes.ICONST_5);
        return;
    }

    if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
