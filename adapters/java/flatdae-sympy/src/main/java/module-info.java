module io.github.cyfko.flatdae.sympy {
    requires io.github.cyfko.flatdae.core;
    requires java.logging;

    exports io.github.cyfko.flatdae.sympy;
}
