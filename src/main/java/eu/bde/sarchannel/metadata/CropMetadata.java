package eu.bde.sarchannel.metadata;

import java.io.Serializable;

public class CropMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private int cropWidth = 150;
    private int cropHeight = 150;
    private RadiometricQuantity outputQuantity = RadiometricQuantity.BETA_NOUGHT;

    public CropMetadata() {
    }

    public CropMetadata(int cropWidth, int cropHeight, RadiometricQuantity outputQuantity) {
        this.cropWidth = cropWidth;
        this.cropHeight = cropHeight;
        this.outputQuantity = outputQuantity;
    }

    public int getCropWidth() {
        return cropWidth;
    }

    public void setCropWidth(int cropWidth) {
        this.cropWidth = cropWidth;
    }

    public int getCropHeight() {
        return cropHeight;
    }

    public void setCropHeight(int cropHeight) {
        this.cropHeight = cropHeight;
    }

    public RadiometricQuantity getOutputQuantity() {
        return outputQuantity;
    }

    public void setOutputQuantity(RadiometricQuantity outputQuantity) {
        this.outputQuantity = outputQuantity;
    }
}
