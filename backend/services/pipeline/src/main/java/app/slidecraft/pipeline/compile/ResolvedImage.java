package app.slidecraft.pipeline.compile;

import org.apache.poi.sl.usermodel.PictureData;

public record ResolvedImage(
        byte[] bytes,
        PictureData.PictureType pictureType,
        boolean placeholder
) {
}
