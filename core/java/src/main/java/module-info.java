module io.github.cyfko.filtertree.core {
    requires java.logging;

    exports io.github.cyfko.filtertree.core;
    exports io.github.cyfko.filtertree.core.api;
    exports io.github.cyfko.filtertree.core.compile;
    exports io.github.cyfko.filtertree.core.config;
    exports io.github.cyfko.filtertree.core.exception;
    exports io.github.cyfko.filtertree.core.utils;
    exports io.github.cyfko.filtertree.core.value;
}
