package com.dynamicdto.contract;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Whitelist of attribute names a Dto type accepts.
 *
 * <p>Usage example:
 * <pre>
 *   {@literal @}Fillable({"name", "email"})
 *   public class UserDto extends Dto { ... }
 * </pre>
 *
 * Types without the annotation (or with an empty value) accept any name.
 * Subclasses inherit the whitelist unless they declare their own.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Inherited
@Documented
public @interface Fillable {

    String[] value();
}
