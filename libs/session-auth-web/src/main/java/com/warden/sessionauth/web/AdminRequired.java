package com.warden.sessionauth.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller method or class as reachable only by an authenticated administrator.
 * <p>
 * Other requests are redirected to the configured admin login page. Takes precedence over
 * {@link LoginRequired} when both apply.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface AdminRequired {
}
