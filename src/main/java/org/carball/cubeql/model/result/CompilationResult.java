package org.carball.cubeql.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.carball.cubeql.exception.CompilationException;

/**
 * Either a compiled query or the error that stopped compilation. Never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompilationResult {
    CompiledQuery compiledQuery;
    String errorCode;
    String errorMessage;
    @JsonIgnore
    CompilationException error;

    public static CompilationResult success(CompiledQuery compiledQuery) {
        return new CompilationResult(compiledQuery, null, null, null);
    }

    public static CompilationResult failure(CompilationException error) {
        return new CompilationResult(null, error.getErrorCode(), error.getMessage(), error);
    }

    public boolean isSuccess() {
        return compiledQuery != null;
    }
}
