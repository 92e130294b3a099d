package com.astrophot.service;

import com.astrophot.model.CelestialPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class SimbadService {

    private static final Logger log = LoggerFactory.getLogger(SimbadService.class);

    private static final String API_URL = "https://cdsweb.u-strasbg.fr/cgi-bin/nph-sesame/-ox?";
    private static final Pattern RA = Pattern.compile("<jradeg>(.*?)</jradeg>");
    private static final Pattern DEC = Pattern.compile("<jdedeg>(.*?)</jdedeg>");

    /** Resuelve un nombre con Sesame; vacío si no se encuentra o no hay red. */
    public Optional<CelestialPoint> search(String objectName) {
        if (objectName == null || objectName.trim().isEmpty()) return Optional.empty();
        try {
            String encoded = URLEncoder.encode(objectName.trim(), StandardCharsets.UTF_8);
            URL url = new URL(API_URL + encoded);

            HttpURLConnection conn = (HttpURLConnection) url.openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(5000); // 5 seg timeout
            conn.setReadTimeout(10000);

            if (conn.getResponseCode() != 200) {
                log.warn("Sesame respondió {} para '{}'", conn.getResponseCode(), objectName);
                return Optional.empty();
            }

            StringBuilder content = new StringBuilder();
            try (BufferedReader in = new BufferedReader(new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
                String inputLine;
                while ((inputLine = in.readLine()) != null) content.append(inputLine);
            }
            Optional<CelestialPoint> p = parse(content.toString());
            if (p.isEmpty()) log.warn("Objeto '{}' no encontrado en Sesame", objectName);
            else log.info("'{}' resuelto a {}", objectName, p.get());
            return p;
        } catch (IOException e) {
            log.warn("No se pudo consultar Sesame para '{}': {}", objectName, e.getMessage());
            return Optional.empty();
        }
    }

    // Buscar etiquetas XML <jradeg> y <jdedeg>
    static Optional<CelestialPoint> parse(String xml) {
        Matcher mRa = RA.matcher(xml);
        Matcher mDec = DEC.matcher(xml);
        if (mRa.find() && mDec.find()) {
            try {
                return Optional.of(new CelestialPoint(Double.parseDouble(mRa.group(1).trim()),
                        Double.parseDouble(mDec.group(1).trim())));
            } catch (IllegalArgumentException e) {
                log.warn("Respuesta de Sesame ilegible: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }
}
