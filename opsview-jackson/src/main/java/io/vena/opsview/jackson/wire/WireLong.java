package io.vena.opsview.jackson.wire;

import com.fasterxml.jackson.annotation.JacksonAnnotationsInside;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a {@link Long} field that the server sends as either a number or a string,
 * and expects back as a string.
 */
@Target(FIELD)
@Retention(RUNTIME)
@JacksonAnnotationsInside
@JsonSerialize(using = StringLongSerializer.class)
@JsonDeserialize(using = LenientLongDeserializer.class)
public @interface WireLong {
}
