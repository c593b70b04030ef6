/// Module for the simple file I/O library: buffered and raw file access with typed OS error reporting.
module com.github.simbo1905.fio {
    requires java.logging;
    requires static lombok;
    exports com.github.simbo1905.fio;
}
