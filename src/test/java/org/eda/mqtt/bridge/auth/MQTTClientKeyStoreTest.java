/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.auth;

import org.eda.mqtt.bridge.model.TlsSettings;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.util.Collections;
import javax.net.ssl.SSLSocketFactory;

import static org.eda.mqtt.bridge.auth.CertificateTestHelper.issueCertificate;
import static org.eda.mqtt.bridge.auth.CertificateTestHelper.newRSAKeyPair;
import static org.eda.mqtt.bridge.auth.CertificateTestHelper.writeEncryptedPem;
import static org.eda.mqtt.bridge.auth.CertificateTestHelper.writePem;
import static org.eda.mqtt.bridge.auth.CertificateTestHelper.writePkcs8Pem;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MQTTClientKeyStoreTest {

    static KeyPair caKeyPair;
    static X509Certificate caCert;
    static KeyPair clientKeyPair;
    static X509Certificate clientCert;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void setUp() throws Exception {
        caKeyPair = newRSAKeyPair();
        caCert = issueCertificate("CA", caKeyPair.getPublic(), "CA", caKeyPair.getPrivate(), true);
        clientKeyPair = newRSAKeyPair();
        clientCert = issueCertificate("client", clientKeyPair.getPublic(), "CA", caKeyPair.getPrivate(), false);
    }

    @Test
    void GIVEN_MQTTClientKeyStore_WHEN_initialized_THEN_keyStoreEmpty() throws Exception {
        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init();

        assertThat(mqttClientKeyStore.getKeyStore().size(), is(0));
    }

    @Test
    void GIVEN_caCertsFile_WHEN_init_THEN_CA_stored() throws Exception {
        Path caFile = tempDir.resolve("ca.pem");
        writePem(caFile, caCert);

        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init(TlsSettings.builder().caCertsFile(caFile).build());

        KeyStore keyStore = mqttClientKeyStore.getKeyStore();
        assertThat(keyStore.size(), is(1));
        assertEquals(caCert, keyStore.getCertificate("CA0"));
    }

    @Test
    void GIVEN_bundleOfCAs_WHEN_updateCA_THEN_previousCAsReplaced() throws Exception {
        KeyPair otherKeyPair = newRSAKeyPair();
        X509Certificate otherCa = issueCertificate("Other CA", otherKeyPair.getPublic(), "Other CA",
                otherKeyPair.getPrivate(), true);
        Path bundle = tempDir.resolve("bundle.pem");
        writePem(bundle, caCert, otherCa);

        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init(TlsSettings.builder().caCertsFile(bundle).build());
        KeyStore keyStore = mqttClientKeyStore.getKeyStore();
        assertThat(keyStore.size(), is(2));
        assertEquals(otherCa, keyStore.getCertificate("CA1"));

        mqttClientKeyStore.updateCA(Collections.singletonList(otherCa));
        assertThat(keyStore.size(), is(1));
        assertEquals(otherCa, keyStore.getCertificate("CA0"));
    }

    @Test
    void GIVEN_clientCertificateAndKey_WHEN_init_THEN_keyEntryStored() throws Exception {
        Path certFile = tempDir.resolve("client.pem");
        Path keyFile = tempDir.resolve("client.key");
        writePem(certFile, clientCert, caCert);
        writePem(keyFile, clientKeyPair.getPrivate());

        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init(TlsSettings.builder().certFile(certFile).keyFile(keyFile).build());

        KeyStore keyStore = mqttClientKeyStore.getKeyStore();
        PrivateKey privateKey = (PrivateKey) keyStore.getKey(MQTTClientKeyStore.KEY_ALIAS,
                MQTTClientKeyStore.DEFAULT_KEYSTORE_PASSWORD);
        assertThat(privateKey.getAlgorithm(), is("RSA"));
        assertThat(keyStore.getCertificateChain(MQTTClientKeyStore.KEY_ALIAS).length, is(2));
        assertEquals(clientCert, keyStore.getCertificateChain(MQTTClientKeyStore.KEY_ALIAS)[0]);
        assertEquals(caCert, keyStore.getCertificateChain(MQTTClientKeyStore.KEY_ALIAS)[1]);
    }

    @Test
    void GIVEN_pkcs8Key_WHEN_readPrivateKey_THEN_keyRead() throws Exception {
        Path keyFile = tempDir.resolve("client-pkcs8.key");
        writePkcs8Pem(keyFile, clientKeyPair.getPrivate());

        PrivateKey key = MQTTClientKeyStore.readPrivateKey(keyFile, null);

        assertSameKey(clientKeyPair.getPrivate(), key);
    }

    @Test
    void GIVEN_encryptedKey_WHEN_readPrivateKeyWithPassword_THEN_keyDecrypted() throws Exception {
        Path keyFile = tempDir.resolve("client-encrypted.key");
        writeEncryptedPem(keyFile, clientKeyPair.getPrivate(), "k3y");

        PrivateKey key = MQTTClientKeyStore.readPrivateKey(keyFile, "k3y");

        assertSameKey(clientKeyPair.getPrivate(), key);
    }

    private static void assertSameKey(PrivateKey expected, PrivateKey actual) {
        assertThat(actual, is(instanceOf(RSAPrivateKey.class)));
        assertEquals(((RSAPrivateKey) expected).getModulus(), ((RSAPrivateKey) actual).getModulus());
        assertEquals(((RSAPrivateKey) expected).getPrivateExponent(), ((RSAPrivateKey) actual).getPrivateExponent());
    }

    @Test
    void GIVEN_fileWithoutKey_WHEN_readPrivateKey_THEN_exceptionThrown() throws Exception {
        Path notAKey = tempDir.resolve("cert-only.pem");
        writePem(notAKey, clientCert);

        assertThrows(IOException.class, () -> MQTTClientKeyStore.readPrivateKey(notAKey, null));
    }

    @Test
    void GIVEN_missingCaFile_WHEN_init_THEN_keyStoreExceptionThrown() {
        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        TlsSettings tls = TlsSettings.builder().caCertsFile(tempDir.resolve("missing.pem")).build();

        assertThrows(KeyStoreException.class, () -> mqttClientKeyStore.init(tls));
    }

    @Test
    void GIVEN_loadedKeyStore_WHEN_getSSLSocketFactory_THEN_returns_SSLSocketFactory() throws Exception {
        Path caFile = tempDir.resolve("ca.pem");
        Path certFile = tempDir.resolve("client.pem");
        Path keyFile = tempDir.resolve("client.key");
        writePem(caFile, caCert);
        writePem(certFile, clientCert);
        writePem(keyFile, clientKeyPair.getPrivate());

        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init(TlsSettings.builder().caCertsFile(caFile).certFile(certFile).keyFile(keyFile).build());
        assertThat(mqttClientKeyStore.getKeyStore().size(), is(2));

        SSLSocketFactory validating = mqttClientKeyStore.getSSLSocketFactory(true);
        SSLSocketFactory trustAll = mqttClientKeyStore.getSSLSocketFactory(false);
        assertThat(validating, is(instanceOf(SSLSocketFactory.class)));
        assertThat(trustAll, is(notNullValue()));
    }

    @Test
    void GIVEN_noCaFile_WHEN_getSSLSocketFactory_THEN_defaultTrustUsed() throws Exception {
        MQTTClientKeyStore mqttClientKeyStore = new MQTTClientKeyStore();
        mqttClientKeyStore.init(TlsSettings.builder().build());

        assertThat(mqttClientKeyStore.getSSLSocketFactory(true), is(notNullValue()));
    }
}
