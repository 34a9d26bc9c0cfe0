package com.yscompiler.re;

import java.util.Optional;

/**
 * Name and raw parameter text captured from a {@code defn name(params)} key.
 */
public record DefnSignature(String name, Optional<String> parameters) {
}
