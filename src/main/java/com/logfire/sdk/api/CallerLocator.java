package com.logfire.sdk.api;

import com.logfire.sdk.core.model.CodeLocation;

import java.util.Set;

/**
 * Finds the user call site of an SDK call: the first stack frame outside the SDK entry
 * points. The file path is the source file under its package directory, e.g.
 * {@code com/example/Checkout.java}.
 */
final class CallerLocator {

    private static final Set<Class<?>> SDK_CLASSES = Set.of(
            Logfire.class, LogfireSpan.class, CallerLocator.class);

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private CallerLocator() {
    }

    static CodeLocation locate() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !SDK_CLASSES.contains(outermost(frame.getDeclaringClass())))
                .findFirst()
                .map(CallerLocator::toLocation)
                .orElse(CodeLocation.unknown()));
    }

    private static CodeLocation toLocation(StackWalker.StackFrame frame) {
        String fileName = frame.getFileName();
        String filepath = null;
        if (fileName != null) {
            String packageName = frame.getDeclaringClass().getPackageName();
            filepath = packageName.isEmpty() ? fileName : packageName.replace('.', '/') + "/" + fileName;
        }
        int line = frame.getLineNumber();
        return new CodeLocation(filepath, line > 0 ? line : -1, frame.getMethodName());
    }

    private static Class<?> outermost(Class<?> type) {
        Class<?> current = type;
        while (current.getEnclosingClass() != null) {
            current = current.getEnclosingClass();
        }
        return current;
    }
}
