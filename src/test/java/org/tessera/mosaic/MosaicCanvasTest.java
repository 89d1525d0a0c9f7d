package org.tessera.mosaic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.imaging.PixelGrid;

@Tag("unit")
class MosaicCanvasTest {

    @Test
    void newCanvasIsBlackAndEmpty() {
        MosaicCanvas canvas = new MosaicCanvas(3, 2, 4);

        assertThat(canvas.getWidth()).isEqualTo(12);
        assertThat(canvas.getHeight()).isEqualTo(8);
        assertThat(canvas.getTotalBlocks()).isEqualTo(6);
        assertThat(canvas.getPastedCount()).isZero();
        assertThat(canvas.isComplete()).isFalse();
        assertThat(canvas.snapshot()).isEqualTo(PixelGrid.filled(12, 8, 0));
    }

    @Test
    void pasteWritesOnlyTheTargetBlock() {
        MosaicCanvas canvas = new MosaicCanvas(2, 2, 3);

        canvas.paste(Box.ofCell(1, 0, 3), PixelGrid.filled(3, 3, 0xABCDEF));

        PixelGrid snapshot = canvas.snapshot();
        assertThat(snapshot.rgbAt(3, 0)).isEqualTo(0xABCDEF);
        assertThat(snapshot.rgbAt(5, 2)).isEqualTo(0xABCDEF);
        assertThat(snapshot.rgbAt(2, 0)).isZero();
        assertThat(snapshot.rgbAt(3, 3)).isZero();
        assertThat(canvas.isPasted(1, 0)).isTrue();
        assertThat(canvas.isPasted(0, 0)).isFalse();
        assertThat(canvas.getImage().getRGB(4, 1) & 0xFFFFFF).isEqualTo(0xABCDEF);
    }

    @Test
    void everyBlockPastedOnceCompletesTheCanvas() {
        MosaicCanvas canvas = new MosaicCanvas(3, 2, 2);
        for (int row = 0; row < 2; row++) {
            for (int column = 0; column < 3; column++) {
                canvas.paste(Box.ofCell(column, row, 2), PixelGrid.filled(2, 2, column + row));
            }
        }

        assertThat(canvas.isComplete()).isTrue();
        assertThat(canvas.getPastedCount()).isEqualTo(6);
    }

    @Test
    void secondPasteIntoSameBlockIsRejected() {
        MosaicCanvas canvas = new MosaicCanvas(2, 1, 2);
        canvas.paste(Box.ofCell(0, 0, 2), PixelGrid.filled(2, 2, 1));

        assertThatThrownBy(() -> canvas.paste(Box.ofCell(0, 0, 2), PixelGrid.filled(2, 2, 2)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(canvas.snapshot().rgbAt(0, 0)).isEqualTo(1);
    }

    @Test
    void misalignedOrOutOfBoundsBoxesAreRejected() {
        MosaicCanvas canvas = new MosaicCanvas(2, 2, 4);
        PixelGrid tile = PixelGrid.filled(4, 4, 0);

        assertThatThrownBy(() -> canvas.paste(new Box(1, 0, 5, 4), tile))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> canvas.paste(new Box(0, 0, 2, 2), tile))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> canvas.paste(Box.ofCell(2, 0, 4), tile))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> canvas.paste(Box.ofCell(0, 0, 4), PixelGrid.filled(3, 3, 0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void forTargetIgnoresPartialTiles() {
        MosaicCanvas canvas = MosaicCanvas.forTarget(PixelGrid.filled(25, 19, 0), 8);

        assertThat(canvas.getXTileCount()).isEqualTo(3);
        assertThat(canvas.getYTileCount()).isEqualTo(2);
    }

    @Test
    void canvasNeedsAtLeastOneTile() {
        assertThatThrownBy(() -> new MosaicCanvas(0, 1, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MosaicCanvas.forTarget(PixelGrid.filled(3, 3, 0), 4))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
