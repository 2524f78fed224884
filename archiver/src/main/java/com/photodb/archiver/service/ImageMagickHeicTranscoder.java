package com.photodb.archiver.service;

import lombok.extern.slf4j.Slf4j;
import org.im4java.core.ConvertCmd;
import org.im4java.core.IM4JavaException;
import org.im4java.core.IMOperation;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * HEIC → JPEG through ImageMagick's convert (needs libheif support in the
 * installed ImageMagick). The JPEG lands in the source directory under a free
 * name, so an existing photo is never overwritten.
 */
@Component
@Slf4j
public class ImageMagickHeicTranscoder implements HeicTranscoder {

    @Override
    public Optional<Path> toJpeg(Path heic) {
        Path jpeg = FilePlacementService.nextFreePath(heic.resolveSibling(baseName(heic) + ".jpg"));

        IMOperation op = new IMOperation();
        op.addImage(heic.toString());
        op.addImage(jpeg.toString());

        try {
            log.info("Converting {} to {}", heic, jpeg.getFileName());
            new ConvertCmd().run(op);
            return Optional.of(jpeg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("HEIC conversion interrupted for {}", heic);
            return Optional.empty();
        } catch (IOException | IM4JavaException e) {
            log.error("HEIC conversion failed for {}: {}", heic, e.getMessage());
            return Optional.empty();
        }
    }

    private String baseName(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }
}
