module io.github.cyfko.flatdae.core {
    requires java.logging;

    exports io.github.cyfko.flatdae.core;
    exports io.github.cyfko.flatdae.core.api;
    exports io.github.cyfko.flatdae.core.ast;
    exports io.github.cyfko.flatdae.core.config;
    exports io.github.cyfko.flatdae.core.dae;
    exports io.github.cyfko.flatdae.core.exception;
    exports io.github.cyfko.flatdae.core.flatten;
    exports io.github.cyfko.flatdae.core.parsing;
    exports io.github.cyfko.flatdae.core.render;
    exports io.github.cyfko.flatdae.core.simulation;
    exports io.github.cyfko.flatdae.core.spi;
}
