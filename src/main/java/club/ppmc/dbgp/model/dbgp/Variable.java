/**
 * Variable.java
 *
 * context_get 或 eval 返回的一个属性 (property)。值已从传输编码 (base64) 解码。
 */
package club.ppmc.dbgp.model.dbgp;

/**
 * @param name 变量名。
 * @param fullName 完全限定名 (fullname 属性)。
 * @param type 运行时类型。
 * @param value 解码后的值。
 */
public record Variable(String name, String fullName, String type, String value) {}
