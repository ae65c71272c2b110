package org.dynamis.builder.compiler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.dynamis.builder.BuilderCompileException;

/**
 * Defines compiled builder functions in a private class loader and keeps them by binary name.
 */
public class ClassManager {

    private final Map<String, Class<?>> classes = new ConcurrentHashMap<>();

    private final ByteArrayClassLoader loader;

    public ClassManager() {
        this(ClassManager.class.getClassLoader());
    }

    public ClassManager(ClassLoader parent) {
        this.loader = new ByteArrayClassLoader(parent);
    }

    public <T> Class<T> getClass(String name) {
        return (Class<T>) classes.get(name);
    }

    public Map<String, Class<?>> getClasses() {
        return classes;
    }

    public ClassLoader getClassLoader() {
        return loader;
    }

    public void define(Map<String, byte[]> byteCode) {
        loader.addAll(byteCode);
        for (String name : byteCode.keySet()) {
            try {
                classes.put(name, loader.loadClass(name));
            } catch (ClassNotFoundException | LinkageError e) {
                throw new BuilderCompileException("Failed to define class '" + name + "'", null, e.getMessage(), e);
            }
        }
    }

    private static final class ByteArrayClassLoader extends ClassLoader {

        private final Map<String, byte[]> bytecodes = new ConcurrentHashMap<>();

        ByteArrayClassLoader(ClassLoader parent) {
            super(parent);
        }

        void addAll(Map<String, byte[]> byteCode) {
            bytecodes.putAll(byteCode);
        }

        @Override
        protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
            synchronized (getClassLoadingLock(name)) {
                Class<?> loaded = findLoadedClass(name);
                if (loaded == null && bytecodes.containsKey(name)) {
                    loaded = findClass(name);
                }
                return loaded != null ? loaded : super.loadClass(name, resolve);
            }
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = bytecodes.get(name);
            if (bytes == null) {
                throw new ClassNotFoundException(name);
            }
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
