package dev.fumaz.ambit.reflection;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.stream.Collectors;

@SuppressWarnings({"unchecked"})
public final class Reflections {

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Constructs {@code clazz} through the first declared constructor accepting {@code parameterTypes}.
     * Exceptions thrown by the constructor itself are rethrown as they are when unchecked.
     */
    public static <T> T construct(Class<T> clazz, Class<?>[] parameterTypes, Object... parameters) {
        Constructor<T> constructor = findConstructor(clazz, parameterTypes);

        try {
            constructor.setAccessible(true);
            return constructor.newInstance(parameters);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();

            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }

            if (cause instanceof Error) {
                throw (Error) cause;
            }

            throw new ReflectionException("Exception whilst constructing " + clazz.getName(), cause);
        } catch (IllegalAccessException | InstantiationException e) {
            throw new ReflectionException("Exception whilst instantiating " + clazz.getName(), e);
        }
    }

    public static <T> Constructor<T> findConstructor(Class<T> clazz, Class<?>[] parameterTypes) {
        if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
            throw new ReflectionException(clazz.getName() + " is not a concrete class");
        }

        return (Constructor<T>) Arrays.stream(clazz.getDeclaredConstructors())
                .filter(constructor -> checkParameters(constructor.getParameterTypes(), parameterTypes))
                .findFirst()
                .orElseThrow(() -> new ReflectionException("Couldn't find a constructor of " + clazz.getName()
                        + " accepting " + describe(parameterTypes)));
    }

    private static boolean checkParameters(Class<?>[] executableParameterTypes, Class<?>[] parameterTypes) {
        if (executableParameterTypes.length != parameterTypes.length) {
            return false;
        }

        for (int i = 0; i < parameterTypes.length; i++) {
            if (!executableParameterTypes[i].isAssignableFrom(parameterTypes[i])) {
                return false;
            }
        }

        return true;
    }

    private static String describe(Class<?>[] parameterTypes) {
        return Arrays.stream(parameterTypes)
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")"));
    }

}
