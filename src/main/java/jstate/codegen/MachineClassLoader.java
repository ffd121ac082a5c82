package jstate.codegen;

import java.util.Map;

/**
 * Class loader for the classes generated for a single state machine.
 *
 * <p>Every machine gets its own loader, so machines with the same name (or
 * states with the same name in different machines) never clash. Everything
 * else is delegated to the parent.
 */
public final class MachineClassLoader extends ClassLoader {

  private final Map<String, byte[]> classFiles;

  MachineClassLoader(ClassLoader parent, Map<String, byte[]> classFiles) {
    super(parent);
    this.classFiles = classFiles;
  }

  @Override
  protected Class<?> findClass(String name) throws ClassNotFoundException {
    final byte[] classBytes = classFiles.get(name);
    if (classBytes == null) {
      throw new ClassNotFoundException(name);
    }
    return defineClass(name, classBytes, 0, classBytes.length);
  }
}
