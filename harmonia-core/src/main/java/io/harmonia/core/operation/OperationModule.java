package io.harmonia.core.operation;

/// A package of operations registered together at startup.
///
/// Modules are enumerated explicitly by the host when the registry is built, so
/// registration never depends on class loading order.
public interface OperationModule {

    /// Registers every operation of this module.
    ///
    /// @param registry the registry to populate, not null
    /// @throws io.harmonia.core.exception.DuplicateOperationException if a type is taken
    void registerAll(OperationRegistry registry);
}
