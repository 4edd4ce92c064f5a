/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.auth;

import lombok.Getter;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;
import org.eda.mqtt.bridge.model.TlsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyManagementException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.UnrecoverableKeyException;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Holds the TLS material of one broker connection: trusted CA certificates and an optional client key entry.
 */
public class MQTTClientKeyStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(MQTTClientKeyStore.class);
    private static final Provider BC_PROVIDER = new BouncyCastleProvider();
    public static final char[] DEFAULT_KEYSTORE_PASSWORD = "".toCharArray();
    public static final String KEY_ALIAS = "eda-mqtt-bridge";
    private static final String CA_ALIAS_PREFIX = "CA";

    @Getter
    private KeyStore keyStore;
    private boolean caLoaded;

    /**
     * Initialize an empty in-memory keystore.
     *
     * @throws KeyStoreException if unable to load keystore
     */
    public void init() throws KeyStoreException {
        keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        try {
            keyStore.load(null, DEFAULT_KEYSTORE_PASSWORD);
        } catch (IOException | NoSuchAlgorithmException | CertificateException e) {
            throw new KeyStoreException("Unable to load keystore", e);
        }
        caLoaded = false;
    }

    /**
     * Initialize the keystore and load the files named by the TLS settings.
     *
     * @param tlsSettings TLS settings
     * @throws KeyStoreException if any certificate or key cannot be read or stored
     */
    public void init(TlsSettings tlsSettings) throws KeyStoreException {
        init();
        try {
            if (tlsSettings.getCaCertsFile() != null) {
                updateCA(readCertificates(tlsSettings.getCaCertsFile()));
            }
            if (tlsSettings.hasClientCertificate()) {
                List<X509Certificate> chain = readCertificates(tlsSettings.getCertFile());
                PrivateKey key = readPrivateKey(tlsSettings.getKeyFile(), tlsSettings.getKeyPassword());
                updateCert(chain, key);
            }
        } catch (IOException | CertificateException e) {
            throw new KeyStoreException("Unable to read TLS material", e);
        }
    }

    /**
     * Replace the trusted CA certificates.
     *
     * @param caCerts CA to trust MQTT broker
     * @throws KeyStoreException if unable to store cert in keystore
     */
    public void updateCA(List<X509Certificate> caCerts) throws KeyStoreException {
        Enumeration<String> entries = keyStore.aliases();
        List<String> existing = new ArrayList<>();
        while (entries.hasMoreElements()) {
            String alias = entries.nextElement();
            if (keyStore.isCertificateEntry(alias)) {
                existing.add(alias);
            }
        }
        for (String alias : existing) {
            keyStore.deleteEntry(alias);
        }
        for (int i = 0; i < caCerts.size(); i++) {
            keyStore.setCertificateEntry(CA_ALIAS_PREFIX + i, caCerts.get(i));
        }
        caLoaded = !caCerts.isEmpty();
        LOGGER.atDebug().addKeyValue("numCaCerts", caCerts.size()).log("CA certificates loaded");
    }

    /**
     * Store the client certificate chain and its private key.
     *
     * @param certChain  client certificate first, followed by its issuers
     * @param privateKey private key of the client certificate
     * @throws KeyStoreException if unable to store the entry
     */
    public void updateCert(List<X509Certificate> certChain, PrivateKey privateKey) throws KeyStoreException {
        if (certChain.isEmpty()) {
            throw new KeyStoreException("Client certificate file contains no certificate");
        }
        keyStore.setKeyEntry(KEY_ALIAS, privateKey, DEFAULT_KEYSTORE_PASSWORD,
                certChain.toArray(new Certificate[0]));
        LOGGER.atDebug().addKeyValue("chainLength", certChain.size()).log("Client certificate loaded");
    }

    /**
     * Gets SSL Socket Factory from Key Store.
     *
     * @param validateCerts false to accept any broker certificate
     * @return SSLSocketFactory
     * @throws KeyStoreException if unable to create Socket Factory
     */
    public SSLSocketFactory getSSLSocketFactory(boolean validateCerts) throws KeyStoreException {
        try {
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, DEFAULT_KEYSTORE_PASSWORD);
            KeyManager[] keyManagers = kmf.getKeyManagers();

            TrustManager[] trustManagers;
            if (validateCerts) {
                TrustManagerFactory tmf =
                        TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                // fall back to the JVM trust store when no CA was given
                tmf.init(caLoaded ? keyStore : null);
                trustManagers = tmf.getTrustManagers();
            } else {
                LOGGER.atWarn().log("Certificate validation disabled, any broker certificate will be accepted");
                trustManagers = new TrustManager[]{new TrustAllManager()};
            }

            SSLContext sc = SSLContext.getInstance("TLS");
            sc.init(keyManagers, trustManagers, null);
            return sc.getSocketFactory();
        } catch (NoSuchAlgorithmException | UnrecoverableKeyException | KeyManagementException e) {
            throw new KeyStoreException("Unable to create SocketFactory from KeyStore", e);
        }
    }

    static List<X509Certificate> readCertificates(Path pemFile) throws IOException, CertificateException {
        CertificateFactory certFactory = CertificateFactory.getInstance("X.509");
        List<X509Certificate> certs = new ArrayList<>();
        try (InputStream certStream = Files.newInputStream(pemFile)) {
            Collection<? extends Certificate> parsed = certFactory.generateCertificates(certStream);
            for (Certificate cert : parsed) {
                certs.add((X509Certificate) cert);
            }
        }
        return certs;
    }

    static PrivateKey readPrivateKey(Path pemFile, String password) throws IOException {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(BC_PROVIDER);
        char[] passwordChars = password == null ? new char[0] : password.toCharArray();
        Object pem;
        try (Reader reader = Files.newBufferedReader(pemFile); PEMParser parser = new PEMParser(reader)) {
            pem = parser.readObject();
        }
        try {
            if (pem instanceof PEMEncryptedKeyPair) {
                pem = ((PEMEncryptedKeyPair) pem).decryptKeyPair(
                        new JcePEMDecryptorProviderBuilder().setProvider(BC_PROVIDER).build(passwordChars));
            }
            if (pem instanceof PKCS8EncryptedPrivateKeyInfo) {
                InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                        .setProvider(BC_PROVIDER).build(passwordChars);
                pem = ((PKCS8EncryptedPrivateKeyInfo) pem).decryptPrivateKeyInfo(decryptor);
            }
        } catch (OperatorCreationException | PKCSException e) {
            throw new IOException("Unable to decrypt private key " + pemFile, e);
        }
        if (pem instanceof PEMKeyPair) {
            return converter.getKeyPair((PEMKeyPair) pem).getPrivate();
        }
        if (pem instanceof PrivateKeyInfo) {
            return converter.getPrivateKey((PrivateKeyInfo) pem);
        }
        throw new IOException("No private key found in " + pemFile);
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
