package com.acme.verify.renderer;

import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.RenderException;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Encodes a payload as a square PNG QR code. Output depends only on the payload and the image size,
 * so identical payloads yield byte-identical images.
 */
public class QrCodeEncoder {

    private static final String FORMAT = "PNG";

    private final int size;
    private final Map<EncodeHintType, Object> hints;

    public QrCodeEncoder(int size) {
        if (size < 21) {
            throw new IllegalArgumentException("QR image size must be at least 21 pixels, was " + size);
        }
        this.size = size;
        Map<EncodeHintType, Object> h = new EnumMap<>(EncodeHintType.class);
        h.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        h.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);
        h.put(EncodeHintType.MARGIN, 2);
        this.hints = h;
    }

    public byte[] encode(String payload) {
        BitMatrix matrix;
        try {
            matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, size, size, hints);
        } catch (WriterException e) {
            // Only raised for payloads that do not fit a QR code
            throw new InvalidInputException("payload cannot be encoded as a QR code: " + e.getMessage(), e);
        }
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, FORMAT, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new RenderException("failed to write QR image: " + e.getMessage(), e);
        }
    }

    public int size() {
        return size;
    }
}
