package com.questrail.busgen.dispatch;

/**
 * Server-side implementation of one method.
 *
 * <p>The returned value follows the native return shape of the method:
 * {@code null} when it has no outputs, the value itself for one output, a
 * {@link com.questrail.busgen.value.Struct} of all outputs otherwise. Throwing
 * {@link MethodErrorException} answers with that error; any other exception
 * answers with {@value MethodErrorException#FAILED}.</p>
 */
@FunctionalInterface
public interface MethodHandler
{
    Object handle(MethodCall call) throws Exception;
}
