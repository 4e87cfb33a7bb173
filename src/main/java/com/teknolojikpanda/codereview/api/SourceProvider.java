package com.teknolojikpanda.codereview.api;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;

/**
 * Supplies the files of a repository revision. Implementations filter to recognised source
 * extensions and cap the candidate list to keep session cost bounded.
 */
public interface SourceProvider {

    @Nonnull
    List<String> listFiles(@Nonnull String repositoryRef, @Nonnull String branchRef) throws IOException;

    @Nonnull
    String readFile(@Nonnull String path) throws IOException;
}
