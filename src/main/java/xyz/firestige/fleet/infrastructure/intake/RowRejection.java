package xyz.firestige.fleet.infrastructure.intake;

/**
 * 被拒绝的 CSV 行
 *
 * @param rowNumber 文件中的行号（表头为第 1 行）
 */
public record RowRejection(int rowNumber, String hostname, String reason) {
}
