package io.vena.opsview.jackson.wire;

import com.fasterxml.jackson.annotation.JacksonAnnotationsInside;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a {@link Boolean} field that travels as <code>"0"</code>/<code>"1"</code>.
 */
@Target(FIELD)
@Retention(RUNTIME)
@JacksonAnnotationsInside
@JsonSerialize(using = StringBooleanSerializer.class)
@JsonDeserialize(using = LenientBooleanDeserializer.class)
public @interface WireBoolean {
}
