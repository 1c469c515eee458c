package com.example.acgarden.utils;

import com.example.acgarden.exception.RepositoryException;
import org.eclipse.jgit.api.AddCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

/**
 * JGit backed {@link CommitRecorder}. Every call opens the repository afresh so
 * no handle outlives a single operation.
 */
@Component
public class GitUtils implements CommitRecorder {

    private static final Logger log = LoggerFactory.getLogger(GitUtils.class);

    private static final String GIT_DIR = ".git";
    private static final TimeZone COMMIT_TIME_ZONE = TimeZone.getTimeZone("UTC");

    @Override
    public boolean hasRepository(Path root) {
        return root != null && Files.isDirectory(root.resolve(GIT_DIR));
    }

    @Override
    public void stage(Path root, List<String> relativePaths) {
        if (relativePaths.isEmpty()) {
            return;
        }
        try (Git git = Git.open(root.toFile())) {
            AddCommand add = git.add();
            for (String path : relativePaths) {
                add.addFilepattern(normalize(path));
            }
            DirCache index = add.call();
            for (String path : relativePaths) {
                if (index.findEntry(normalize(path)) < 0) {
                    throw new RepositoryException(path + " was not staged in " + root + ", is it ignored?");
                }
            }
            log.debug("Staged {} in {}", relativePaths, root);
        } catch (RepositoryException e) {
            throw e;
        } catch (Exception e) {
            throw new RepositoryException("Failed to stage " + relativePaths + " in " + root + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String commit(Path root, String authorName, String authorEmail, long epochSecond, String message) {
        PersonIdent ident = new PersonIdent(authorName, authorEmail,
                new Date(epochSecond * 1000L), COMMIT_TIME_ZONE);
        try (Git git = Git.open(root.toFile())) {
            RevCommit commit = git.commit()
                    .setAuthor(ident)
                    .setCommitter(ident)
                    .setMessage(message)
                    .setSign(Boolean.FALSE)
                    .setNoVerify(true)
                    .call();
            String id = commit.getId().name();
            log.info("Committed {} as {}", id, message);
            return id;
        } catch (Exception e) {
            throw new RepositoryException("Failed to commit '" + message + "' in " + root + ": " + e.getMessage(), e);
        }
    }

    private static String normalize(String path) {
        String p = path.replace('\\', '/');
        if (p.startsWith("./")) p = p.substring(2);
        return p;
    }
}
