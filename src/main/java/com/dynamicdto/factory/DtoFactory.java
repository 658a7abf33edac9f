package com.dynamicdto.factory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dynamicdto.AttributeResult;
import com.dynamicdto.Dto;
import com.dynamicdto.QuietConstruction;
import com.dynamicdto.exception.DtoInvalidArgumentException;
import com.dynamicdto.exception.DtoNotFoundException;

/**
 * Builds Dto instances from loosely shaped data.
 *
 * Construction is best effort: entries the target type rejects (not fillable,
 * numeric keys and so on) are dropped. Only structural problems, an unusable
 * target type or empty source data, raise {@link DtoInvalidArgumentException}.
 *
 * The target's {@code (Map)} constructor is preferred and runs inside a
 * {@link QuietConstruction} scope. Without one, the no-argument constructor is
 * used and must leave the Dto uninitialized so the data reaches its first fill.
 */
public final class DtoFactory {

    private static final Logger log = LoggerFactory.getLogger(DtoFactory.class);

    private static final SourceNormalizer NORMALIZER = new SourceNormalizer();

    private DtoFactory() {
        // Utility class
    }

    public static <T extends Dto> T make(Object source, Class<T> dtoClass) {
        validateDtoClass(dtoClass);
        Constructor<T> mapConstructor = findConstructor(dtoClass, Map.class);
        Constructor<T> noArgConstructor = mapConstructor == null ? findConstructor(dtoClass) : null;
        if (mapConstructor == null && noArgConstructor == null) {
            throw new DtoInvalidArgumentException("Dto class " + dtoClass.getName()
                    + " must declare a (Map) or a no-argument constructor");
        }

        Map<String, Object> values = NORMALIZER.normalize(source);

        T dto;
        if (mapConstructor != null) {
            dto = QuietConstruction.run(() -> instantiate(mapConstructor, values));
            dto.shouldBeSilent(false);
            log.debug("Built {} from {} entries, {} kept", dtoClass.getSimpleName(), values.size(), dto.count());
        } else {
            dto = instantiate(noArgConstructor);
            if (dto.isInitialized()) {
                throw new DtoInvalidArgumentException("Dto class " + dtoClass.getName()
                        + " must leave the Dto uninitialized from its no-argument constructor");
            }
            List<AttributeResult> rejected = dto.fillQuietly(values);
            dto.shouldBeSilent(false);
            log.debug("Built {} from {} entries, {} dropped", dtoClass.getSimpleName(), values.size(), rejected.size());
        }
        return dto;
    }

    /**
     * Resolves {@code dtoClassName} with the factory's class loader and builds it.
     */
    public static Dto make(Object source, String dtoClassName) {
        if (dtoClassName == null || dtoClassName.isBlank()) {
            throw new DtoInvalidArgumentException("Dto class must be provided");
        }

        Class<?> type;
        try {
            type = Class.forName(dtoClassName.trim(), false, DtoFactory.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new DtoNotFoundException(dtoClassName, e);
        }

        return make(source, asDtoClass(type));
    }

    private static Class<? extends Dto> asDtoClass(Class<?> type) {
        if (!Dto.class.isAssignableFrom(type)) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + type.getName() + " must extend " + Dto.class.getName());
        }
        return type.asSubclass(Dto.class);
    }

    private static void validateDtoClass(Class<? extends Dto> dtoClass) {
        if (dtoClass == null) {
            throw new DtoInvalidArgumentException("Dto class must be provided");
        }
        if (dtoClass == Dto.class || !Dto.class.isAssignableFrom(dtoClass)) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + dtoClass.getName() + " must extend " + Dto.class.getName());
        }
        if (dtoClass.isInterface() || Modifier.isAbstract(dtoClass.getModifiers())) {
            throw new DtoInvalidArgumentException("Dto class " + dtoClass.getName() + " must be instantiable");
        }
        if (dtoClass.getEnclosingClass() != null && !Modifier.isStatic(dtoClass.getModifiers())) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + dtoClass.getName() + " must be instantiable (inner classes are not supported)");
        }
    }

    /**
     * Returns the accessible constructor with the given parameters, or null when there is none.
     */
    private static <T extends Dto> Constructor<T> findConstructor(Class<T> dtoClass, Class<?>... parameterTypes) {
        try {
            Constructor<T> constructor = dtoClass.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            return null;
        } catch (RuntimeException e) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + dtoClass.getName() + " must be instantiable", e);
        }
    }

    private static <T extends Dto> T instantiate(Constructor<T> constructor, Object... arguments) {
        try {
            return constructor.newInstance(arguments);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + constructor.getDeclaringClass().getName() + " must be instantiable", e);
        } catch (InvocationTargetException e) {
            throw new DtoInvalidArgumentException(
                    "Dto class " + constructor.getDeclaringClass().getName() + " failed to construct",
                    e.getTargetException());
        }
    }
}
