/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.nexaflow.memory.utils;


import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable and writable directory. Creates it if asked to.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is not a usable directory, or does not exist and creation was not
     *                                  requested.
     */
    public static Path ensurePath(Path path, boolean createIfNotExists) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.debug("Created directory {}", absolutePath);
            }
            catch (Exception e) {
                throw new IllegalStateException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException("Sanity check for %s Failed. Please check it is a directory and has the required permissions"
                    .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Replaces the contents of a file. Data goes to a temporary file in the same directory first and is then moved
     * over the target, so readers never see a half written file. Parent directories are created as needed.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     * @return The absolute path of the written file
     */
    @SneakyThrows
    public static Path write(Path filePath, byte[] data) {
        final var target = filePath.toAbsolutePath().normalize();
        final var parent = ensurePath(target.getParent(), true);
        final var temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
        return target;
    }
}
