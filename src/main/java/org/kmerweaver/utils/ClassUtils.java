package org.kmerweaver.utils;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Utilities for dealing with reflection.
 */
public final class ClassUtils {
    private ClassUtils(){}

    /**
     * Returns true iff we can make instances of this class.
     * Note that this will return false if the class does not have any public constructors.
     */
    public static boolean canMakeInstances(final Class<?> clazz) {
        return clazz != null &&
                !clazz.isPrimitive()  &&
                !clazz.isSynthetic()  &&
                !clazz.isInterface()  &&
                !clazz.isLocalClass() &&
                !Modifier.isPrivate(clazz.getModifiers()) &&
                !Modifier.isAbstract(clazz.getModifiers()) &&
                clazz.getConstructors().length != 0;
    }

    /**
     * Gets a list of classes that are either the same as, or a subclass/subinterface of a parent target class.
     * @param targetClass Parent {@link Class} for which to check for inheritance.
     * @param classesToSearch Classes to check for inheritance against {@code targetClass}.
     * @return {@link List} of classes from {@code classesToSearch} that inherit from {@code targetClass}.
     */
    public static List<Class<?>> getClassesOfType(final Class<?> targetClass, final List<Class<?>> classesToSearch) {
        final List<Class<?>> classList = new ArrayList<>();
        for ( final Class<?> clazz : classesToSearch ) {
            if ( targetClass.isAssignableFrom(clazz) ) {
                classList.add( clazz );
            }
        }
        return classList;
    }
}
