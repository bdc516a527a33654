package io.evitadb.irasutoya;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes files by way of a sibling temporary file that is flushed to disk and then moved over the target.
 * Readers observe either the previous or the complete new content.
 *
 * The temporary file is created with the default permissions of the file system (the process umask on
 * POSIX systems), so the target ends up with the same permissions as any plainly written file.
 */
final class AtomicFiles {

	private AtomicFiles() {
	}

	/**
	 * Writes content produced by the writer to the target. Parent directories are created when missing.
	 *
	 * @param target  the file to replace
	 * @param suffix  suffix of the temporary file
	 * @param content callback writing the new content
	 * @throws IOException if the content cannot be written or moved; the target is left untouched
	 */
	static void write(@Nonnull Path target, @Nonnull String suffix, @Nonnull ContentWriter content) throws IOException {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(suffix, "suffix must not be null");
		Objects.requireNonNull(content, "content must not be null");

		final Path absolute = target.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		Files.createDirectories(parent);

		final Path temp = parent.resolve(absolute.getFileName() + "." + UUID.randomUUID() + suffix);
		try {
			try (final FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
				final OutputStream out = Channels.newOutputStream(channel);
				content.writeTo(out);
				out.flush();
				channel.force(true);
			}
			try {
				Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	/**
	 * Writes the bytes to the target.
	 */
	static void write(@Nonnull Path target, @Nonnull String suffix, @Nonnull byte[] bytes) throws IOException {
		Objects.requireNonNull(bytes, "bytes must not be null");
		write(target, suffix, out -> out.write(bytes));
	}

	/**
	 * Produces the content of the file. The stream must not be closed.
	 */
	@FunctionalInterface
	interface ContentWriter {

		void writeTo(@Nonnull OutputStream out) throws IOException;

	}
}
