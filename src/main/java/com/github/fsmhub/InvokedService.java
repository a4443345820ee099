package com.github.fsmhub;

/**
 * Long-running unit of external work started when a state is entered. The returned value becomes
 * the payload of the state's done event; a thrown exception becomes the payload of its error
 * event. Implementations should respond to interruption since timeouts and state exits cancel them.
 */
@FunctionalInterface
public interface InvokedService<S extends Enum<S>, E extends Enum<E>> {

  Object invoke(MachineContext<S, E> snapshot) throws Exception;

}
