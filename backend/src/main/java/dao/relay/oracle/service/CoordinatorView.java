package dao.relay.oracle.service;

import java.util.OptionalLong;

/**
 * Era id as seen by the oracle coordinator contract; empty when none is configured.
 */
@FunctionalInterface
public interface CoordinatorView {

    CoordinatorView NONE = OptionalLong::empty;

    OptionalLong currentEraId();
}
