package org.arpha.dispatch.http.annotation;

import org.arpha.dispatch.routing.RouteMethod;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface HttpRoute {

    String path();

    RouteMethod method() default RouteMethod.GET;
}
