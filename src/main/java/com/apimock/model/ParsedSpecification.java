package com.apimock.model;

/**
 * A fully dereferenced API description, tagged with the format it was read as.
 * There are exactly two cases: {@link SwaggerSpecification} and {@link OpenApiV3Specification}.
 */
public interface ParsedSpecification {

    /**
     * @return the format tag used to dispatch conversion; never {@link SpecificationVersion#UNRECOGNIZED}
     */
    SpecificationVersion version();
}
